package com.repoforensics.cli;

import com.repoforensics.RepoForensicsCLI;
import com.repoforensics.core.report.RankingDocument;
import com.repoforensics.core.report.RankingReportReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests running the command line against a small results directory.
 */
class RepoForensicsCLITest {

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @TempDir
    Path tempDir;

    private Path resultsDir;

    @BeforeEach
    void setUp() throws IOException {
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));

        resultsDir = Files.createDirectories(tempDir.resolve("demo"));
        Files.writeString(resultsDir.resolve("demo_code-analysis_revisions.csv"), """
            entity,n-revs
            src/app.py,60
            src/util.py,5
            """);
        Files.writeString(resultsDir.resolve("complexity.json"), """
            {"functions": [
              {"file": "src/app.py", "function_name": "main", "cyclomatic_complexity": 16, "nloc": 40},
              {"file": "src/util.py", "function_name": "helper", "cyclomatic_complexity": 2, "nloc": 8}
            ]}
            """);
        Files.writeString(resultsDir.resolve("commits.json"), """
            {"commits": [
              {"hash": "1", "author_name": "Jane", "author_email": "jane@example.com", "date": "2024-06-01T10:00:00Z"},
              {"hash": "2", "author_name": "Jane", "author_email": "jane@example.com", "date": "2024-06-02T10:00:00Z"},
              {"hash": "3", "author_name": "John", "author_email": "john@example.com", "date": "2023-01-01T10:00:00Z"}
            ]}
            """);
        Files.writeString(resultsDir.resolve("demo_code-analysis_entity_ownership.csv"), """
            entity,author,added,deleted
            src/app.py,Jane,400,100
            src/util.py,John,20,5
            """);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void rank_withResultsDirectory_writesAllReports() throws IOException {
        // When
        int exitCode = execute("rank", resultsDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(resultsDir.resolve("demo_developer_ranking.csv")).exists();
        assertThat(resultsDir.resolve("demo_hotspots.json")).exists();
        assertThat(resultsDir.resolve("demo_ranking_summary.txt")).exists();

        RankingDocument document = new RankingReportReader().read(resultsDir.resolve("demo_developer_ranking.json"));
        assertThat(document.rankings()).extracting(RankingDocument.Entry::developer).containsExactly("Jane", "John");
        assertThat(stdout()).contains("DEVELOPER RANKING REPORT").contains("✓ Ranked 2 developers");
    }

    @Test
    void rank_withDryRun_writesNothing() {
        int exitCode = execute("rank", resultsDir.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(resultsDir.resolve("demo_developer_ranking.json")).doesNotExist();
        assertThat(stdout()).contains("Dry-run mode: no reports written");
    }

    @Test
    void rank_withExplicitJsonTarget_writesThere() {
        Path target = tempDir.resolve("out/ranking.json");

        int exitCode = execute("rank", resultsDir.toString(), "--output-json", target.toString(),
            "-o", tempDir.resolve("reports").toString());

        assertThat(exitCode).isZero();
        assertThat(target).exists();
        assertThat(tempDir.resolve("reports/demo_developer_ranking.json")).doesNotExist();
        assertThat(tempDir.resolve("reports/demo_hotspots.csv")).exists();
    }

    @Test
    void rank_withWeightsNotSummingToOne_returnsConfigError() {
        int exitCode = execute("rank", resultsDir.toString(), "--weight-commits", "0.9");

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
        assertThat(stderr()).contains("Weights must sum to 1.0");
    }

    @Test
    void rank_withMalformedExplicitConfig_returnsConfigErrorBeforeWritingReports() throws IOException {
        // Given
        Path config = tempDir.resolve("broken.yaml");
        Files.writeString(config, """
            ranking:
              weights:
                commits: lots
            """);

        // When
        int exitCode = execute("rank", resultsDir.toString(), "-c", config.toString());

        // Then
        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
        assertThat(stderr()).contains("Invalid configuration");
        assertThat(resultsDir.resolve("demo_developer_ranking.json")).doesNotExist();
    }

    @Test
    void rank_withMissingExplicitConfig_returnsConfigError() {
        int exitCode = execute("rank", resultsDir.toString(), "--config", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
        assertThat(stderr()).contains("not found");
    }

    @Test
    void rank_withMalformedDefaultConfig_fallsBackToDefaults() throws IOException {
        Files.writeString(resultsDir.resolve("repoforensics.yaml"), "weights: [not, a, map\n");

        int exitCode = execute("rank", resultsDir.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_OK);
    }

    @Test
    void rank_withUnknownOutputFormat_returnsConfigError() throws IOException {
        Files.writeString(resultsDir.resolve("repoforensics.yaml"), """
            output:
              formats: [ranking-json, pdf]
            """);

        int exitCode = execute("rank", resultsDir.toString());

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
    }

    @Test
    void rank_withMissingResultsDirectory_returnsFailure() {
        int exitCode = execute("rank", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_FAILURE);
        assertThat(stderr()).contains("Results directory not found");
    }

    @Test
    void hotspots_writesHotspotReports() {
        int exitCode = execute("hotspots", resultsDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("CRITICAL").contains("src/app.py");
        assertThat(resultsDir.resolve("demo_hotspots.json")).exists();
        assertThat(resultsDir.resolve("demo_developer_ranking.json")).doesNotExist();
    }

    @Test
    void validate_withValidConfig_printsWeights() throws IOException {
        Path config = tempDir.resolve("repoforensics.yaml");
        Files.writeString(config, """
            project:
              name: demo
            ranking:
              weights:
                commits: 0.25
                hotspot_work: 0.10
            """);

        int exitCode = execute("validate", config.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Configuration is valid").contains("Commits");
    }

    @Test
    void validate_withUnknownWeightKey_returnsConfigError() throws IOException {
        Path config = tempDir.resolve("repoforensics.yaml");
        Files.writeString(config, """
            ranking:
              weights:
                lines: 0.5
            """);

        assertThat(execute("validate", config.toString())).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
    }

    @Test
    void validate_withMissingFile_returnsConfigError() {
        int exitCode = execute("validate", tempDir.resolve("nope.yaml").toString());

        assertThat(exitCode).isEqualTo(AbstractAnalysisCommand.EXIT_CONFIG_ERROR);
        assertThat(stderr()).contains("not found");
    }

    @Test
    void list_sources_printsAllLoaders() {
        int exitCode = execute("list", "sources");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("(ID: revisions)").contains("(ID: communication)");
    }

    @Test
    void list_withUnknownType_returnsFailure() {
        assertThat(execute("list", "widgets")).isEqualTo(1);
    }

    private int execute(String... args) {
        return RepoForensicsCLI.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
