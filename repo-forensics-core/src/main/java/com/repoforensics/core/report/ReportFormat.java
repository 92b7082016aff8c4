package com.repoforensics.core.report;

import java.util.Arrays;
import java.util.Optional;

/**
 * Report files that can be produced from an analysis result.
 */
public enum ReportFormat {
    /** Full developer ranking as JSON. */
    RANKING_JSON("{repo}_developer_ranking.json", "application/json"),

    /** Hotspot table as JSON. */
    HOTSPOTS_JSON("{repo}_hotspots.json", "application/json"),

    /** One row per developer. */
    RANKING_CSV("{repo}_developer_ranking.csv", "text/csv"),

    /** One row per hotspot file. */
    HOTSPOTS_CSV("{repo}_hotspots.csv", "text/csv"),

    /** Human-readable ranking table and breakdown. */
    SUMMARY_TEXT("{repo}_ranking_summary.txt", "text/plain");

    private final String defaultFileName;
    private final String contentType;

    ReportFormat(String defaultFileName, String contentType) {
        this.defaultFileName = defaultFileName;
        this.contentType = contentType;
    }

    /**
     * Returns the default file name pattern; {@code {repo}} is replaced with the repository name.
     *
     * @return file name pattern
     */
    public String defaultFileName() {
        return defaultFileName;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Looks up a format by name, ignoring case and accepting hyphens for underscores.
     *
     * @param name format name such as {@code ranking-json}
     * @return the format, or empty if unknown
     */
    public static Optional<ReportFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        return Arrays.stream(values())
            .filter(format -> format.name().equals(normalized))
            .findFirst();
    }
}
