package com.repoforensics.core.source;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LoadContext}.
 */
class LoadContextTest extends SourceLoaderTestBase {

    @Test
    void expectedPath_replacesRepositoryPlaceholder() {
        assertThat(context.expectedPath("{repo}_code-analysis_soc.csv"))
            .isEqualTo(resultsDir.resolve("demo_code-analysis_soc.csv"));
    }

    @Test
    void fileNameFor_withOverride_returnsOverride() {
        LoadContext custom = createContext(null, Map.of("commits", "git-log.json"));

        assertThat(custom.fileNameFor("commits", "commits.json")).isEqualTo("git-log.json");
        assertThat(custom.fileNameFor("revisions", "r.csv")).isEqualTo("r.csv");
    }

    @Test
    void resolveSource_withExactFile_returnsIt() throws IOException {
        Path file = createFile("demo_code-analysis_revisions.csv", "entity,n-revs\n");

        assertThat(context.resolveSource("{repo}_code-analysis_revisions.csv")).contains(file);
    }

    @Test
    void resolveSource_withOtherRepositoryPrefix_fallsBackToGlob() throws IOException {
        // Given
        Path file = createFile("legacy-name_code-analysis_revisions.csv", "entity,n-revs\n");

        // When / Then
        assertThat(context.resolveSource("{repo}_code-analysis_revisions.csv")).contains(file);
    }

    @Test
    void resolveSource_withoutPlaceholder_doesNotGlob() throws IOException {
        createFile("old-commits.json", "{}");

        assertThat(context.resolveSource("commits.json")).isEmpty();
    }

    @Test
    void resolveSource_withMissingFile_returnsEmpty() throws IOException {
        assertThat(context.resolveSource("{repo}_code-analysis_soc.csv")).isEmpty();
    }
}
