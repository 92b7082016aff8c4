package com.repoforensics.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneratedFile}.
 */
class GeneratedFileTest {

    @Test
    void constructor_withValidInputs_createsFile() {
        GeneratedFile file = new GeneratedFile("demo_hotspots.csv", "file,hotspot_score\n", "text/csv");

        assertThat(file.fileName()).isEqualTo("demo_hotspots.csv");
        assertThat(file.content()).isEqualTo("file,hotspot_score\n");
        assertThat(file.contentType()).isEqualTo("text/csv");
    }

    @Test
    void constructor_withNullFileName_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile(null, "content", "text/plain"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("fileName");
    }

    @Test
    void constructor_withBlankFileName_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("  ", "content", "text/plain"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_withNullContent_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("summary.txt", null, "text/plain"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content");
    }

    @Test
    void sizeInBytes_countsUtf8Bytes() {
        GeneratedFile file = new GeneratedFile("summary.txt", "✓ ok", "text/plain");

        assertThat(file.sizeInBytes()).isEqualTo(6);
    }

    @Test
    void hasContentType_ignoresCase() {
        GeneratedFile file = new GeneratedFile("summary.txt", "", "Text/Plain");

        assertThat(file.hasContentType("text/plain")).isTrue();
        assertThat(file.hasContentType("text/csv")).isFalse();
        assertThat(new GeneratedFile("x", "", null).hasContentType("text/plain")).isFalse();
    }
}
