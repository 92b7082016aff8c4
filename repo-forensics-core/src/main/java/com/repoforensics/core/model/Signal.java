package com.repoforensics.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The ten contribution signals accumulated per developer.
 *
 * <p>Each signal has a stable snake_case key used in configuration files, JSON reports and
 * CLI output. The declaration order is the order used everywhere signals are listed.
 *
 * @since 1.0.0
 */
public enum Signal {
    /** One point per commit attributed to the author. */
    COMMITS("commits", "Commits"),

    /** Lines added plus lines deleted. */
    CHURN("churn", "Code Churn"),

    /** Churn on hotspot files, weighted by the hotspot score. */
    HOTSPOT_WORK("hotspot_work", "Hotspot Work"),

    /** Sum of ownership fractions over files where the author is the main developer. */
    OWNERSHIP("ownership", "Ownership"),

    /** Churn weighted by the average complexity of the touched file. */
    COMPLEXITY("complexity", "Complexity"),

    /** Shared files times collaboration strength, summed over peers. */
    COMMUNICATION("communication", "Communication"),

    /** Age-bucketed commit activity; recent commits count more. */
    RECENCY("recency", "Recency"),

    /** Churn weighted by the fractal value of the touched file. */
    FRAGMENTATION("fragmentation", "Fragmentation"),

    /** Churn weighted by the sum of coupling of the touched file. */
    COUPLING("coupling", "Coupling"),

    /** Number of distinct hotspot files touched. */
    HOTSPOT_COMMITS("hotspot_commits", "Hotspot Commits");

    private final String key;
    private final String displayName;

    Signal(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Returns the snake_case key of this signal (e.g. {@code hotspot_work}).
     *
     * @return configuration and report key
     */
    public String key() {
        return key;
    }

    /**
     * Returns the human-readable name of this signal.
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Looks up a signal by its key. Matching ignores case and accepts hyphens for underscores.
     *
     * @param key signal key such as {@code hotspot_work} or {@code hotspot-work}
     * @return the matching signal, or empty if the key is unknown
     */
    public static Optional<Signal> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
            .filter(signal -> signal.key.equals(normalized))
            .findFirst();
    }
}
