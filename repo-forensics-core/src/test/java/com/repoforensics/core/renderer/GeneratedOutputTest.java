package com.repoforensics.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneratedOutput}.
 */
class GeneratedOutputTest {

    @Test
    void find_withKnownFileName_returnsFile() {
        GeneratedFile json = new GeneratedFile("demo_hotspots.json", "{}", "application/json");
        GeneratedOutput output = new GeneratedOutput(List.of(json));

        assertThat(output.find("demo_hotspots.json")).contains(json);
        assertThat(output.find("other.json")).isEmpty();
        assertThat(output.isEmpty()).isFalse();
    }

    @Test
    void constructor_withNullFiles_throwsException() {
        assertThatThrownBy(() -> new GeneratedOutput(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_createsImmutableCopy() {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("a.txt", "a", "text/plain"));
        GeneratedOutput output = new GeneratedOutput(files);

        files.add(new GeneratedFile("b.txt", "b", "text/plain"));

        assertThat(output.files()).hasSize(1);
        assertThatThrownBy(() -> output.files().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
