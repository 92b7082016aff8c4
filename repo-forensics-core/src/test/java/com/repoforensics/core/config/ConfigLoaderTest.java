package com.repoforensics.core.config;

import com.repoforensics.core.model.Signal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "demo"
              repositoryRoot: "/work/repositories/demo"

            sources:
              commits: history.json

            ranking:
              top: 5
              detailed: 2
              topFiles: 3
              weights:
                commits: 0.25
                churn: 0.02

            output:
              directory: "./reports"
              formats: [RANKING_JSON, SUMMARY_TEXT]
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("demo");
        assertThat(config.repositoryRoot()).isEqualTo("/work/repositories/demo");
        assertThat(config.sourceFileNames()).containsEntry("commits", "history.json");
        assertThat(config.top()).isEqualTo(5);
        assertThat(config.detailed()).isEqualTo(2);
        assertThat(config.topFiles()).isEqualTo(3);
        assertThat(config.weightVector().weight(Signal.COMMITS)).isEqualTo(0.25);
        assertThat(config.weightVector().weight(Signal.CHURN)).isEqualTo(0.02);
        assertThat(config.output().directory()).isEqualTo("./reports");
        assertThat(config.output().formats()).containsExactly("RANKING_JSON", "SUMMARY_TEXT");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, "ranking: [unclosed");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.top()).isEqualTo(ProjectConfig.DEFAULT_TOP);
        assertThat(config.weightVector().isValid()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("extra.yaml");
        Files.writeString(configFile, """
            project:
              name: demo
              owner: someone
            dashboards:
              enabled: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("demo");
    }

    @Test
    void loadStrict_missingFile_throwsConfigurationException() {
        assertThatThrownBy(() -> ConfigLoader.loadStrict(tempDir.resolve("absent.yaml")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("absent.yaml");
    }

    @Test
    void loadStrict_invalidYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("broken.yaml");
        Files.writeString(configFile, "ranking:\n  top: [1, 2\n");

        assertThatThrownBy(() -> ConfigLoader.loadStrict(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid configuration");
    }
}
