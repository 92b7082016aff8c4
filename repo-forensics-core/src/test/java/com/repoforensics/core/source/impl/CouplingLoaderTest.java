package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.CouplingRecord;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoaderTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CouplingLoader}.
 */
class CouplingLoaderTest extends SourceLoaderTestBase {

    private final CouplingLoader loader = new CouplingLoader();

    @Test
    void load_readsSumOfCoupling() throws IOException {
        createFile("demo_code-analysis_soc.csv", """
            entity,soc
            src/app.py,310
            src/util.py,x
            """);

        LoadResult result = loader.load(context);

        assertThat(result.recordsOf(CouplingRecord.class)).containsExactly(new CouplingRecord("src/app.py", 310));
        assertThat(result.statistics().rowsSkipped()).isEqualTo(1);
    }
}
