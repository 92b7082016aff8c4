package com.repoforensics.core.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.HotspotReport;
import com.repoforensics.core.model.RiskLevel;

import java.util.List;

/**
 * JSON representation of the hotspot table.
 *
 * @param repository repository name
 * @param generatedAt analysis time (ISO-8601)
 * @param filesWithRevisions files with revision data
 * @param unmatchedFiles files with revisions but no matched complexity
 * @param totalHotspots number of hotspots
 * @param hotspots hotspots by descending score
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HotspotDocument(
    @JsonProperty("repository") String repository,
    @JsonProperty("generated_at") String generatedAt,
    @JsonProperty("files_with_revisions") int filesWithRevisions,
    @JsonProperty("unmatched_files") int unmatchedFiles,
    @JsonProperty("total_hotspots") int totalHotspots,
    @JsonProperty("hotspots") List<Entry> hotspots
) {
    /**
     * Builds the document for a hotspot report.
     *
     * @param report hotspot report
     * @return hotspot document
     */
    public static HotspotDocument from(HotspotReport report) {
        return new HotspotDocument(
            report.repository(),
            report.generatedAt().toString(),
            report.filesWithRevisions(),
            report.unmatchedFiles(),
            report.hotspots().size(),
            report.hotspots().stream().map(Entry::from).toList()
        );
    }

    /**
     * One hotspot file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("file") String file,
        @JsonProperty("hotspot_score") double hotspotScore,
        @JsonProperty("risk_level") RiskLevel riskLevel,
        @JsonProperty("revisions") int revisions,
        @JsonProperty("avg_complexity") double avgComplexity,
        @JsonProperty("max_complexity") int maxComplexity,
        @JsonProperty("function_count") int functionCount,
        @JsonProperty("total_lines_of_code") long totalLinesOfCode
    ) {
        static Entry from(Hotspot hotspot) {
            return new Entry(
                hotspot.file(),
                hotspot.hotspotScore(),
                hotspot.riskLevel(),
                hotspot.revisions(),
                hotspot.avgComplexity(),
                hotspot.maxComplexity(),
                hotspot.functionCount(),
                hotspot.totalLinesOfCode()
            );
        }
    }
}
