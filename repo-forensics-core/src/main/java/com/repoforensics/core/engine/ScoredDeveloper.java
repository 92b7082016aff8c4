package com.repoforensics.core.engine;

import com.repoforensics.core.model.Signal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A developer with normalized signal values.
 *
 * @param metrics raw accumulated metrics
 * @param normalized value per signal in [0, 100]
 */
public record ScoredDeveloper(DeveloperMetrics metrics, Map<Signal, Double> normalized) {

    public ScoredDeveloper {
        Objects.requireNonNull(metrics, "metrics must not be null");
        normalized = Collections.unmodifiableMap(new EnumMap<>(normalized));
    }

    /**
     * Returns the normalized value of a signal.
     *
     * @param signal the signal
     * @return value in [0, 100]
     */
    public double normalized(Signal signal) {
        return normalized.getOrDefault(signal, 0.0);
    }
}
