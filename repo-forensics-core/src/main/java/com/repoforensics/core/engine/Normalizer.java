package com.repoforensics.core.engine;

import com.repoforensics.core.model.Signal;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rescales each raw signal to [0, 100] relative to the highest value across developers.
 *
 * <p>For every signal, {@code normalized = raw / max * 100}. When the maximum is 0 (or there
 * are no developers) every normalized value is 0; the division never happens.
 */
public class Normalizer {

    /**
     * Normalizes all signals.
     *
     * @param developers developers in ranking tie-break order
     * @return developers with normalized values, in the same order
     */
    public List<ScoredDeveloper> normalize(List<DeveloperMetrics> developers) {
        Map<Signal, Double> maxima = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            double max = 0.0;
            for (DeveloperMetrics developer : developers) {
                max = Math.max(max, developer.raw(signal));
            }
            maxima.put(signal, max);
        }

        return developers.stream()
            .map(developer -> {
                Map<Signal, Double> normalized = new EnumMap<>(Signal.class);
                for (Signal signal : Signal.values()) {
                    normalized.put(signal, normalize(developer.raw(signal), maxima.get(signal)));
                }
                return new ScoredDeveloper(developer, normalized);
            })
            .toList();
    }

    /**
     * Normalizes one value.
     *
     * @param raw raw value
     * @param max maximum raw value of the signal
     * @return value in [0, 100], or 0 if max is not positive
     */
    static double normalize(double raw, double max) {
        if (max <= 0.0) {
            return 0.0;
        }
        return raw / max * 100.0;
    }
}
