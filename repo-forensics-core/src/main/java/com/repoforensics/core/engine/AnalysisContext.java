package com.repoforensics.core.engine;

import com.repoforensics.core.model.QualityGap;
import com.repoforensics.core.source.LoadResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one analysis run.
 *
 * <p>Every table the pipeline fills lives here; nothing survives the run.
 */
public class AnalysisContext {

    private final AnalysisRequest request;
    private final Instant analysisTime;
    private final FileMetricsStore fileMetrics = new FileMetricsStore();
    private final Map<String, LoadResult> loadResults = new LinkedHashMap<>();
    private final List<QualityGap> qualityGaps = new ArrayList<>();

    AnalysisContext(AnalysisRequest request, Instant analysisTime) {
        this.request = request;
        this.analysisTime = analysisTime;
    }

    public AnalysisRequest request() {
        return request;
    }

    public Instant analysisTime() {
        return analysisTime;
    }

    public FileMetricsStore fileMetrics() {
        return fileMetrics;
    }

    void addLoadResult(LoadResult result) {
        loadResults.put(result.loaderId(), result);
    }

    public Map<String, LoadResult> loadResults() {
        return loadResults;
    }

    void addGap(QualityGap gap) {
        qualityGaps.add(gap);
    }

    public List<QualityGap> qualityGaps() {
        return qualityGaps;
    }
}
