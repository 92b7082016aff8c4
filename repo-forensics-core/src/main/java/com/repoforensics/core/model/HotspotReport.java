package com.repoforensics.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranked hotspot table produced by one analysis run.
 *
 * @param repository repository name
 * @param generatedAt analysis time
 * @param filesWithRevisions number of files with revision data
 * @param unmatchedFiles files with revisions but no matched complexity data
 * @param hotspots hotspots sorted by descending score
 */
public record HotspotReport(
    String repository,
    Instant generatedAt,
    int filesWithRevisions,
    int unmatchedFiles,
    List<Hotspot> hotspots
) {
    /**
     * Compact constructor with validation.
     */
    public HotspotReport {
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        hotspots = hotspots == null ? List.of() : List.copyOf(hotspots);
    }
}
