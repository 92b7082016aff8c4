package com.repoforensics.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withMatchingPattern_returnsSortedFiles() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("b_code-analysis_soc.csv"), "");
        Files.writeString(tempDir.resolve("a_code-analysis_soc.csv"), "");
        Files.writeString(tempDir.resolve("commits.json"), "");
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested/c_code-analysis_soc.csv"), "");

        // When
        List<Path> files = FileUtils.findFiles(tempDir, "*_code-analysis_soc.csv");

        // Then
        assertThat(files).extracting(path -> path.getFileName().toString())
            .containsExactly("a_code-analysis_soc.csv", "b_code-analysis_soc.csv");
    }

    @Test
    void findFiles_withNoMatch_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir, "*.csv")).isEmpty();
    }

    @Test
    void toForwardSlashes_replacesBackslashes() {
        assertThat(FileUtils.toForwardSlashes("src\\main\\App.java")).isEqualTo("src/main/App.java");
    }

    @Test
    void stripPrefix_removesRepositoryRoot() {
        assertThat(FileUtils.stripPrefix("/work/demo/src/app.py", "/work/demo")).isEqualTo("src/app.py");
        assertThat(FileUtils.stripPrefix("/work/demo/src/app.py", "/work/demo/")).isEqualTo("src/app.py");
        assertThat(FileUtils.stripPrefix("/work/demo2/app.py", "/work/demo")).isEqualTo("/work/demo2/app.py");
        assertThat(FileUtils.stripPrefix("src/app.py", null)).isEqualTo("src/app.py");
    }

    @Test
    void truncate_cutsLongText() {
        assertThat(FileUtils.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(FileUtils.truncate("abc", 3)).isEqualTo("abc");
    }
}
