package com.repoforensics.core.report;

import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.report.impl.JsonReportGenerator;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportEmitter}.
 */
class ReportEmitterTest {

    @Test
    void discoverGenerators_findsAllRegisteredGenerators() {
        List<ReportGenerator> generators = ReportEmitter.discoverGenerators();

        assertThat(generators).extracting(ReportGenerator::getId)
            .containsExactlyInAnyOrder("json", "csv", "text");
    }

    @Test
    void emit_allFormats_producesOneFilePerFormat() {
        // Given
        ReportEmitter emitter = new ReportEmitter();

        // When
        GeneratedOutput output = emitter.emit(ReportFixtures.sampleResult(),
            EnumSet.allOf(ReportFormat.class), ReportConfig.defaults());

        // Then
        assertThat(output.files()).extracting(GeneratedFile::fileName).containsExactlyInAnyOrder(
            "demo_developer_ranking.json", "demo_hotspots.json",
            "demo_developer_ranking.csv", "demo_hotspots.csv", "demo_ranking_summary.txt");
        assertThat(output.find("demo_hotspots.csv")).get()
            .satisfies(file -> assertThat(file.contentType()).isEqualTo("text/csv"));
    }

    @Test
    void emit_withCustomFileName_usesIt() {
        ReportConfig config = ReportConfig.defaults().withFileName(ReportFormat.RANKING_JSON, "{repo}-ranking.json");

        GeneratedOutput output = new ReportEmitter()
            .emit(ReportFixtures.sampleResult(), List.of(ReportFormat.RANKING_JSON), config);

        assertThat(output.find("demo-ranking.json")).isPresent();
    }

    @Test
    void emit_withUnsupportedFormat_throwsException() {
        ReportEmitter emitter = new ReportEmitter(List.of(new JsonReportGenerator()));

        assertThatThrownBy(() -> emitter.emit(ReportFixtures.sampleResult(),
                List.of(ReportFormat.SUMMARY_TEXT), ReportConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("SUMMARY_TEXT");
    }

    @Test
    void fromName_acceptsDashesAndCase() {
        assertThat(ReportFormat.fromName("ranking-json")).contains(ReportFormat.RANKING_JSON);
        assertThat(ReportFormat.fromName("Summary_Text")).contains(ReportFormat.SUMMARY_TEXT);
        assertThat(ReportFormat.fromName("xml")).isEmpty();
    }
}
