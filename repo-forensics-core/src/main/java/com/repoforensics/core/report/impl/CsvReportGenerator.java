package com.repoforensics.core.report.impl;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.report.GeneratedReport;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportFormat;
import com.repoforensics.core.report.ReportGenerator;
import com.repoforensics.core.util.Rounding;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes the developer ranking and the hotspot table as CSV with a header row.
 *
 * <p>Every developer and every hotspot gets a row. Scores are rounded to two decimals.
 */
public class CsvReportGenerator implements ReportGenerator {

    static final List<String> RANKING_COLUMNS = List.of(
        "rank", "developer", "email", "weighted_score", "commits", "lines_added", "lines_deleted",
        "total_churn", "hotspot_score", "hotspot_files_count", "hotspot_commits", "ownership_score",
        "files_owned_count", "complexity_score", "communication_score", "collaborators_count",
        "recency_score", "fragmentation_score", "coupling_score", "last_commit_date"
    );

    static final List<String> HOTSPOT_COLUMNS = List.of(
        "file", "hotspot_score", "risk_level", "revisions", "avg_complexity", "max_complexity",
        "function_count", "total_lines_of_code"
    );

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public String getDisplayName() {
        return "CSV Report Generator";
    }

    @Override
    public Set<ReportFormat> getSupportedFormats() {
        return Set.of(ReportFormat.RANKING_CSV, ReportFormat.HOTSPOTS_CSV);
    }

    @Override
    public GeneratedReport generate(AnalysisResult result, ReportFormat format, ReportConfig config) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String fileName = config.fileName(format, result.repository());
        String content = switch (format) {
            case RANKING_CSV -> write(RANKING_COLUMNS,
                result.ranking().rankings().stream().map(this::rankingRow).toList(), fileName);
            case HOTSPOTS_CSV -> write(HOTSPOT_COLUMNS,
                result.hotspots().hotspots().stream().map(this::hotspotRow).toList(), fileName);
            default -> throw new IllegalArgumentException("Unsupported report format: " + format);
        };
        return new GeneratedReport(format, fileName, content);
    }

    private String write(List<String> columns, List<Map<String, Object>> rows, String fileName) {
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);

        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema.build().withHeader()).writeValues(out)) {
            for (Map<String, Object> row : rows) {
                writer.write(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        return out.toString();
    }

    private Map<String, Object> rankingRow(DeveloperRanking developer) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("rank", developer.rank());
        row.put("developer", developer.developer());
        row.put("email", developer.email() != null ? developer.email() : "");
        row.put("weighted_score", Rounding.round2(developer.compositeScore()));
        row.put("commits", Math.round(developer.raw(Signal.COMMITS)));
        row.put("lines_added", developer.linesAdded());
        row.put("lines_deleted", developer.linesDeleted());
        row.put("total_churn", developer.totalChurn());
        row.put("hotspot_score", Rounding.round2(developer.raw(Signal.HOTSPOT_WORK)));
        row.put("hotspot_files_count", developer.hotspotFiles().size());
        row.put("hotspot_commits", Math.round(developer.raw(Signal.HOTSPOT_COMMITS)));
        row.put("ownership_score", Rounding.round2(developer.raw(Signal.OWNERSHIP)));
        row.put("files_owned_count", developer.ownedFiles().size());
        row.put("complexity_score", Rounding.round2(developer.raw(Signal.COMPLEXITY)));
        row.put("communication_score", Rounding.round2(developer.raw(Signal.COMMUNICATION)));
        row.put("collaborators_count", developer.collaborators().size());
        row.put("recency_score", Rounding.round2(developer.raw(Signal.RECENCY)));
        row.put("fragmentation_score", Rounding.round2(developer.raw(Signal.FRAGMENTATION)));
        row.put("coupling_score", Rounding.round2(developer.raw(Signal.COUPLING)));
        row.put("last_commit_date", developer.lastCommitDate() != null ? developer.lastCommitDate().toString() : "");
        return row;
    }

    private Map<String, Object> hotspotRow(Hotspot hotspot) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("file", hotspot.file());
        row.put("hotspot_score", Rounding.round2(hotspot.hotspotScore()));
        row.put("risk_level", hotspot.riskLevel().name());
        row.put("revisions", hotspot.revisions());
        row.put("avg_complexity", Rounding.round2(hotspot.avgComplexity()));
        row.put("max_complexity", hotspot.maxComplexity());
        row.put("function_count", hotspot.functionCount());
        row.put("total_lines_of_code", hotspot.totalLinesOfCode());
        return row;
    }
}
