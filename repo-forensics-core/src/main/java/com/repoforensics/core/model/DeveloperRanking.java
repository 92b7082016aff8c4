package com.repoforensics.core.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final, immutable ranking entry for one developer.
 *
 * @param rank 1-based position in the ranking (unique)
 * @param developer author display name
 * @param email first e-mail address seen for the author, may be null
 * @param compositeScore weighted sum of the normalized signals
 * @param rawScores raw accumulated value per signal
 * @param normalizedScores value per signal rescaled to [0, 100]
 * @param linesAdded lines added across ownership records
 * @param linesDeleted lines deleted across ownership records
 * @param lastCommitDate latest parseable commit timestamp, may be null
 * @param ownedFiles files where the developer is the main developer, in input order
 * @param hotspotFiles distinct hotspot files touched, in first-touch order
 * @param collaborators collaboration partners, in input order
 */
public record DeveloperRanking(
    int rank,
    String developer,
    String email,
    double compositeScore,
    Map<Signal, Double> rawScores,
    Map<Signal, Double> normalizedScores,
    long linesAdded,
    long linesDeleted,
    OffsetDateTime lastCommitDate,
    List<OwnedFile> ownedFiles,
    List<String> hotspotFiles,
    List<Collaborator> collaborators
) {
    /**
     * Compact constructor with validation and defensive copies.
     */
    public DeveloperRanking {
        Objects.requireNonNull(developer, "developer must not be null");
        rawScores = Collections.unmodifiableMap(new EnumMap<>(Objects.requireNonNull(rawScores, "rawScores must not be null")));
        normalizedScores = Collections.unmodifiableMap(new EnumMap<>(Objects.requireNonNull(normalizedScores, "normalizedScores must not be null")));
        ownedFiles = ownedFiles == null ? List.of() : List.copyOf(ownedFiles);
        hotspotFiles = hotspotFiles == null ? List.of() : List.copyOf(hotspotFiles);
        collaborators = collaborators == null ? List.of() : List.copyOf(collaborators);
    }

    /**
     * Returns the raw value of a signal.
     *
     * @param signal the signal
     * @return raw value, 0 if absent
     */
    public double raw(Signal signal) {
        return rawScores.getOrDefault(signal, 0.0);
    }

    /**
     * Returns the normalized value of a signal.
     *
     * @param signal the signal
     * @return normalized value in [0, 100], 0 if absent
     */
    public double normalized(Signal signal) {
        return normalizedScores.getOrDefault(signal, 0.0);
    }

    /**
     * Returns lines added plus lines deleted.
     *
     * @return total churn
     */
    public long totalChurn() {
        return linesAdded + linesDeleted;
    }
}
