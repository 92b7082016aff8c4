package com.repoforensics.core.report;

import com.repoforensics.core.engine.AnalysisResult;

import java.util.Set;

/**
 * Interface for report generators that serialize an analysis result.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Each generator
 * produces one or more {@link ReportFormat}s.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.repoforensics.core.report.ReportGenerator}
 *
 * @see ReportEmitter
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator (e.g., "json", "csv").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the formats this generator can produce.
     *
     * @return supported formats
     */
    Set<ReportFormat> getSupportedFormats();

    /**
     * Generates one report.
     *
     * <p>Empty results produce a valid, empty report rather than an error.
     *
     * @param result analysis result
     * @param format format to produce
     * @param config report settings
     * @return generated report
     * @throws IllegalArgumentException if the format is not supported
     */
    GeneratedReport generate(AnalysisResult result, ReportFormat format, ReportConfig config);
}
