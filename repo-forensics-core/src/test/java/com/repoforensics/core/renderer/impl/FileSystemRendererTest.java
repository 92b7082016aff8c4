package com.repoforensics.core.renderer.impl;

import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllToOutputDirectory() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("demo_developer_ranking.json", "{\"rankings\":[]}", "application/json"),
            new GeneratedFile("demo_ranking_summary.txt", "Jürgen ✓\n", "text/plain")));

        // When
        renderer.render(output, RenderContext.of(tempDir));

        // Then
        assertThat(tempDir.resolve("demo_developer_ranking.json")).hasContent("{\"rankings\":[]}");
        assertThat(Files.readString(tempDir.resolve("demo_ranking_summary.txt"))).isEqualTo("Jürgen ✓\n");
    }

    @Test
    void render_withMissingDirectory_createsIt() {
        Path outputDir = tempDir.resolve("reports/2024");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.csv", "x\n", "text/csv")));

        renderer.render(output, RenderContext.of(outputDir));

        assertThat(outputDir.resolve("a.csv")).exists();
    }

    @Test
    void render_withExistingFile_overwritesIt() throws IOException {
        Files.writeString(tempDir.resolve("a.csv"), "old");

        renderer.render(new GeneratedOutput(List.of(new GeneratedFile("a.csv", "new", "text/csv"))),
            RenderContext.of(tempDir));

        assertThat(tempDir.resolve("a.csv")).hasContent("new");
    }

    @Test
    void render_withFileNameOutsideOutputDirectory_throwsException() {
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../escape.txt", "x", "text/plain")));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.of(outputDir)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("escape.txt")).doesNotExist();
    }
}
