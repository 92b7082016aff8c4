package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.MainDeveloperRecord;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoaderTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MainDeveloperLoader}.
 */
class MainDeveloperLoaderTest extends SourceLoaderTestBase {

    private final MainDeveloperLoader loader = new MainDeveloperLoader();

    @Test
    void load_readsOwnershipFractionAndIgnoresExtraColumns() throws IOException {
        createFile("demo_code-analysis_main_dev.csv", """
            entity,main-dev,added,total-added,ownership
            src/app.py,Jane,80,100,0.8
            """);

        LoadResult result = loader.load(context);

        assertThat(result.recordsOf(MainDeveloperRecord.class))
            .containsExactly(new MainDeveloperRecord("src/app.py", "Jane", 0.8));
    }

    @Test
    void load_withOwnershipOutOfRange_skipsRow() throws IOException {
        createFile("demo_code-analysis_main_dev.csv", """
            entity,main-dev,added,total-added,ownership
            src/a.py,Jane,80,100,1.5
            src/b.py,Jane,80,100,NaN
            src/c.py,Jane,0,0,0.0
            """);

        LoadResult result = loader.load(context);

        assertThat(result.recordsOf(MainDeveloperRecord.class)).extracting(MainDeveloperRecord::file)
            .containsExactly("src/c.py");
        assertThat(result.statistics().errorCounts())
            .containsEntry("out of range", 1)
            .containsEntry("invalid number", 1);
    }
}
