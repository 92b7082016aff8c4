package com.repoforensics.core.report.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.RiskLevel;
import com.repoforensics.core.report.GeneratedReport;
import com.repoforensics.core.report.RankingDocument;
import com.repoforensics.core.report.RankingReportReader;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportFixtures;
import com.repoforensics.core.report.ReportFormat;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link JsonReportGenerator}.
 */
class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();
    private final AnalysisResult result = ReportFixtures.sampleResult();

    @Test
    void generate_rankingJson_readsBackWithSameOrderAndScores() throws IOException {
        // Given
        GeneratedReport report = generator.generate(result, ReportFormat.RANKING_JSON, ReportConfig.defaults());

        // When
        RankingDocument document = new RankingReportReader().parse(report.content());

        // Then
        assertThat(report.fileName()).isEqualTo("demo_developer_ranking.json");
        assertThat(document.repository()).isEqualTo("demo");
        assertThat(document.totalDevelopers()).isEqualTo(2);
        assertThat(document.rankings()).extracting(RankingDocument.Entry::developer)
            .containsExactly("Jane Doe", "John Smith");
        for (int i = 0; i < document.rankings().size(); i++) {
            DeveloperRanking expected = result.ranking().rankings().get(i);
            assertThat(document.rankings().get(i).weightedScore()).isCloseTo(expected.compositeScore(), within(1e-6));
        }
        assertThat(document.qualityGaps()).hasSize(1);
        assertThat(document.weights()).containsEntry("hotspot_work", 0.20);
    }

    @Test
    void generate_rankingJson_writesSnakeCaseFields() throws IOException {
        GeneratedReport report = generator.generate(result, ReportFormat.RANKING_JSON, ReportConfig.defaults());

        JsonNode root = new ObjectMapper().readTree(report.content());
        JsonNode first = root.get("rankings").get(0);

        assertThat(root.has("total_developers")).isTrue();
        assertThat(root.get("generated_at").asText()).isEqualTo("2024-06-30T00:00:00Z");
        assertThat(first.get("metrics").get("total_churn").asLong()).isEqualTo(1500);
        assertThat(first.get("metrics").get("last_commit_date").asText()).startsWith("2024-06-20");
        assertThat(first.get("normalized_scores").has("hotspot_commits")).isTrue();
        assertThat(root.get("quality_gaps").get(0).get("source").asText()).isEqualTo("soc");
    }

    @Test
    void generate_rankingJson_sortsAndLimitsTopLists() throws IOException {
        ReportConfig config = new ReportConfig(20, 0, 1, Map.of());

        RankingDocument document = new RankingReportReader()
            .parse(generator.generate(result, ReportFormat.RANKING_JSON, config).content());

        RankingDocument.Entry jane = document.rankings().get(0);
        assertThat(jane.topOwnedFiles()).hasSize(1);
        assertThat(jane.topOwnedFiles().get(0).file()).isEqualTo("src/app.py");
        assertThat(jane.topCollaborators()).extracting(RankingDocument.CollaboratorEntry::name)
            .containsExactly("Ann Lee");
    }

    @Test
    void generate_hotspotsJson_writesRiskLevels() throws IOException {
        GeneratedReport report = generator.generate(result, ReportFormat.HOTSPOTS_JSON, ReportConfig.defaults());

        JsonNode root = new ObjectMapper().readTree(report.content());

        assertThat(root.get("total_hotspots").asInt()).isEqualTo(2);
        assertThat(root.get("unmatched_files").asInt()).isEqualTo(1);
        assertThat(root.get("hotspots").get(0).get("risk_level").asText()).isEqualTo(RiskLevel.HIGH.name());
        assertThat(root.get("hotspots").get(0).get("avg_complexity").asDouble()).isEqualTo(10.0);
    }

    @Test
    void generate_withTextFormat_throwsException() {
        assertThatThrownBy(() -> generator.generate(result, ReportFormat.SUMMARY_TEXT, ReportConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
