package com.repoforensics.core.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.report.GeneratedReport;
import com.repoforensics.core.report.HotspotDocument;
import com.repoforensics.core.report.RankingDocument;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportFormat;
import com.repoforensics.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Writes the developer ranking and the hotspot table as indented JSON.
 *
 * <p>Scores are written unrounded; the ranking file can be read back with
 * {@link com.repoforensics.core.report.RankingReportReader}.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Report Generator";
    }

    @Override
    public Set<ReportFormat> getSupportedFormats() {
        return Set.of(ReportFormat.RANKING_JSON, ReportFormat.HOTSPOTS_JSON);
    }

    @Override
    public GeneratedReport generate(AnalysisResult result, ReportFormat format, ReportConfig config) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Object document = switch (format) {
            case RANKING_JSON -> RankingDocument.from(result, config.topFiles());
            case HOTSPOTS_JSON -> HotspotDocument.from(result.hotspots());
            default -> throw new IllegalArgumentException("Unsupported report format: " + format);
        };

        String fileName = config.fileName(format, result.repository());
        try {
            String content = objectMapper.writeValueAsString(document);
            log.debug("Serialized {} ({} characters)", fileName, content.length());
            return new GeneratedReport(format, fileName, content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + fileName + ": " + e.getMessage(), e);
        }
    }
}
