package com.repoforensics.core.model;

import java.util.Objects;

/**
 * A file that has both revision history and complexity data, scored for change risk.
 *
 * @param file file path as first seen in the revision data
 * @param hotspotScore combined change-frequency and complexity score, rounded to 2 decimals
 * @param riskLevel discrete risk classification
 * @param revisions number of revisions of the file
 * @param avgComplexity average cyclomatic complexity per function
 * @param maxComplexity highest cyclomatic complexity of a single function
 * @param functionCount number of functions measured
 * @param totalLinesOfCode lines of code summed over all measured functions
 */
public record Hotspot(
    String file,
    double hotspotScore,
    RiskLevel riskLevel,
    int revisions,
    double avgComplexity,
    int maxComplexity,
    int functionCount,
    long totalLinesOfCode
) {
    /**
     * Compact constructor with validation.
     */
    public Hotspot {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
    }
}
