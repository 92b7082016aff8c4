package com.repoforensics.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Represents a gap or issue detected while loading inputs for an analysis run.
 *
 * <p>Quality gaps indicate signals that are incomplete: a missing source file, rows that had
 * to be skipped, or paths that could not be reconciled with the revision data.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * QualityGap gap = QualityGap.warning(
 *     "soc",
 *     "Source file not found; coupling stays at 0 for every developer"
 * );
 * }</pre>
 *
 * @param sourceId the ID of the source loader (or engine stage) that detected the gap
 * @param message human-readable description of the gap
 * @param severity severity level of the gap
 */
public record QualityGap(
    @JsonProperty("source") String sourceId,
    @JsonProperty("message") String message,
    @JsonProperty("severity") GapSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public QualityGap {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }

    /**
     * Create an informational gap.
     *
     * @param sourceId the source ID
     * @param message the message
     * @return a new QualityGap with INFO severity
     */
    public static QualityGap info(String sourceId, String message) {
        return new QualityGap(sourceId, message, GapSeverity.INFO);
    }

    /**
     * Create a warning gap.
     *
     * @param sourceId the source ID
     * @param message the message
     * @return a new QualityGap with WARNING severity
     */
    public static QualityGap warning(String sourceId, String message) {
        return new QualityGap(sourceId, message, GapSeverity.WARNING);
    }

    /**
     * Create an error gap.
     *
     * @param sourceId the source ID
     * @param message the message
     * @return a new QualityGap with ERROR severity
     */
    public static QualityGap error(String sourceId, String message) {
        return new QualityGap(sourceId, message, GapSeverity.ERROR);
    }
}
