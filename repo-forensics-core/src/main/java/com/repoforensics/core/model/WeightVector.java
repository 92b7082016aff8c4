package com.repoforensics.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weighting scheme for the ten contribution signals.
 *
 * <p>A usable vector has non-negative weights that sum to 1.0 within {@link #TOLERANCE}.
 * This record does not reject invalid vectors on construction so that configuration
 * errors can be reported with context; {@link #isValid()} and
 * {@link com.repoforensics.core.engine.WeightedRanker#validate(WeightVector)} perform the check.
 *
 * <p>Signals without an explicit weight are treated as 0.
 *
 * @param weights weight per signal
 */
public record WeightVector(Map<Signal, Double> weights) {

    /** Allowed deviation of the weight sum from 1.0. */
    public static final double TOLERANCE = 0.001;

    /**
     * Compact constructor that copies the weights into an unmodifiable enum map.
     */
    public WeightVector {
        Objects.requireNonNull(weights, "weights must not be null");
        EnumMap<Signal, Double> copy = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            Double value = weights.get(signal);
            copy.put(signal, value != null ? value : 0.0);
        }
        weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the default weighting scheme.
     *
     * <pre>
     * commits 0.15, churn 0.12, hotspot_work 0.20, ownership 0.15, complexity 0.08,
     * communication 0.10, recency 0.08, fragmentation 0.05, coupling 0.05, hotspot_commits 0.02
     * </pre>
     *
     * @return default weights (sum 1.0)
     */
    public static WeightVector defaults() {
        EnumMap<Signal, Double> defaults = new EnumMap<>(Signal.class);
        defaults.put(Signal.COMMITS, 0.15);
        defaults.put(Signal.CHURN, 0.12);
        defaults.put(Signal.HOTSPOT_WORK, 0.20);
        defaults.put(Signal.OWNERSHIP, 0.15);
        defaults.put(Signal.COMPLEXITY, 0.08);
        defaults.put(Signal.COMMUNICATION, 0.10);
        defaults.put(Signal.RECENCY, 0.08);
        defaults.put(Signal.FRAGMENTATION, 0.05);
        defaults.put(Signal.COUPLING, 0.05);
        defaults.put(Signal.HOTSPOT_COMMITS, 0.02);
        return new WeightVector(defaults);
    }

    /**
     * Returns the weight of a signal.
     *
     * @param signal the signal
     * @return weight, 0 if not set
     */
    public double weight(Signal signal) {
        return weights.get(signal);
    }

    /**
     * Returns a copy of this vector with one weight replaced.
     *
     * @param signal signal to change
     * @param weight new weight
     * @return new weight vector
     */
    public WeightVector with(Signal signal, double weight) {
        EnumMap<Signal, Double> copy = new EnumMap<>(weights);
        copy.put(signal, weight);
        return new WeightVector(copy);
    }

    /**
     * Returns the sum of all weights.
     *
     * @return weight sum
     */
    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Returns true if every weight is a non-negative number and the sum is 1.0 within tolerance.
     *
     * @return true if the vector can be used for ranking
     */
    public boolean isValid() {
        boolean nonNegative = weights.values().stream()
            .allMatch(w -> !w.isNaN() && !w.isInfinite() && w >= 0.0);
        return nonNegative && Math.abs(sum() - 1.0) <= TOLERANCE;
    }

    /**
     * Returns the weights keyed by {@link Signal#key()} in declaration order.
     *
     * @return ordered map of signal key to weight
     */
    public Map<String, Double> toKeyedMap() {
        Map<String, Double> keyed = new LinkedHashMap<>();
        weights.forEach((signal, weight) -> keyed.put(signal.key(), weight));
        return keyed;
    }
}
