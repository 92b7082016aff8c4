package com.repoforensics.core.engine;

import com.repoforensics.core.model.HotspotReport;
import com.repoforensics.core.model.QualityGap;
import com.repoforensics.core.model.RankingReport;
import com.repoforensics.core.source.LoadResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one analysis run.
 *
 * @param repository repository name
 * @param generatedAt analysis time
 * @param hotspots hotspot table
 * @param ranking developer ranking
 * @param qualityGaps missing sources, skipped rows and unmatched paths
 * @param loadResults load results keyed by loader ID, in execution order
 */
public record AnalysisResult(
    String repository,
    Instant generatedAt,
    HotspotReport hotspots,
    RankingReport ranking,
    List<QualityGap> qualityGaps,
    Map<String, LoadResult> loadResults
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(repository, "repository must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(hotspots, "hotspots must not be null");
        Objects.requireNonNull(ranking, "ranking must not be null");
        qualityGaps = qualityGaps == null ? List.of() : List.copyOf(qualityGaps);
        loadResults = loadResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(loadResults));
    }
}
