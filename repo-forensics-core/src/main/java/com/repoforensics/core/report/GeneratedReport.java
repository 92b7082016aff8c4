package com.repoforensics.core.report;

import java.util.Objects;

/**
 * Represents a generated report.
 *
 * @param format report format
 * @param fileName file name relative to the output directory
 * @param content report content
 */
public record GeneratedReport(
    ReportFormat format,
    String fileName,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
