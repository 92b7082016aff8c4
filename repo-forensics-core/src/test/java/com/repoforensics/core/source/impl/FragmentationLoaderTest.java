package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.FragmentationRecord;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoaderTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FragmentationLoader}.
 */
class FragmentationLoaderTest extends SourceLoaderTestBase {

    private final FragmentationLoader loader = new FragmentationLoader();

    @Test
    void load_readsFractalValues() throws IOException {
        createFile("demo_code-analysis_fragmentation.csv", """
            entity,fractal-value,total-revs
            src/app.py,0.62,14
            """);

        LoadResult result = loader.load(context);

        assertThat(result.recordsOf(FragmentationRecord.class))
            .containsExactly(new FragmentationRecord("src/app.py", 0.62));
    }

    @Test
    void load_withConfiguredFileName_readsIt() throws IOException {
        createFile("frag.csv", "entity,fractal-value\nsrc/app.py,0.5\n");

        LoadResult result = loader.load(createContext(null, Map.of("fragmentation", "frag.csv")));

        assertThat(result.records()).hasSize(1);
    }
}
