package com.repoforensics.core.report;

import com.repoforensics.core.config.ProjectConfig;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for report generation.
 *
 * @param top developers shown in the summary table
 * @param detailed developers shown in the detailed breakdown, 0 disables it
 * @param topFiles length of per-developer top lists and of the hotspot excerpt
 * @param fileNames file name overrides per format
 */
public record ReportConfig(
    int top,
    int detailed,
    int topFiles,
    Map<ReportFormat, String> fileNames
) {
    /**
     * Compact constructor with validation.
     */
    public ReportConfig {
        if (top < 0) {
            top = 0;
        }
        if (detailed < 0) {
            detailed = 0;
        }
        if (topFiles < 0) {
            topFiles = 0;
        }
        fileNames = fileNames == null || fileNames.isEmpty() ? Map.of() : Map.copyOf(fileNames);
    }

    /**
     * Creates a default configuration.
     *
     * @return default report config
     */
    public static ReportConfig defaults() {
        return new ReportConfig(ProjectConfig.DEFAULT_TOP, 0, ProjectConfig.DEFAULT_TOP_FILES, Map.of());
    }

    /**
     * Creates a configuration from the project configuration.
     *
     * @param config project configuration
     * @return report config
     */
    public static ReportConfig from(ProjectConfig config) {
        return new ReportConfig(config.top(), config.detailed(), config.topFiles(), Map.of());
    }

    /**
     * Returns a copy with a file name override.
     *
     * @param format report format
     * @param fileName file name to use
     * @return new config
     */
    public ReportConfig withFileName(ReportFormat format, String fileName) {
        Map<ReportFormat, String> names = new EnumMap<>(ReportFormat.class);
        names.putAll(fileNames);
        names.put(format, fileName);
        return new ReportConfig(top, detailed, topFiles, names);
    }

    /**
     * Returns the file name of a report.
     *
     * @param format report format
     * @param repository repository name
     * @return configured or default file name
     */
    public String fileName(ReportFormat format, String repository) {
        String pattern = fileNames.getOrDefault(format, format.defaultFileName());
        return pattern.replace("{repo}", repository);
    }
}
