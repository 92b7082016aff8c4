package com.repoforensics.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Developer ranking produced by one analysis run.
 *
 * @param repository repository name
 * @param generatedAt analysis time
 * @param weights weighting scheme used for the composite score
 * @param rankings developers ordered by descending composite score
 */
public record RankingReport(
    String repository,
    Instant generatedAt,
    WeightVector weights,
    List<DeveloperRanking> rankings
) {
    /**
     * Compact constructor with validation.
     */
    public RankingReport {
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        rankings = rankings == null ? List.of() : List.copyOf(rankings);
    }

    /**
     * Returns the number of ranked developers.
     *
     * @return developer count
     */
    public int totalDevelopers() {
        return rankings.size();
    }
}
