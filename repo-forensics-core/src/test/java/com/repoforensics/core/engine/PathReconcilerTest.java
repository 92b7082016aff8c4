package com.repoforensics.core.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PathReconciler}.
 */
class PathReconcilerTest {

    private PathReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new PathReconciler();
    }

    @Test
    void canonicalize_withBackslashesAndMixedCase_returnsLowercaseForwardSlashes() {
        assertThat(PathReconciler.canonicalize(" Src\\Main\\App.java "))
            .isEqualTo("src/main/app.java");
    }

    @Test
    void canonicalize_appliedTwice_returnsSameKey() {
        String once = PathReconciler.canonicalize("C:\\Work\\Repo\\Foo.PY");

        assertThat(PathReconciler.canonicalize(once)).isEqualTo(once);
    }

    @Test
    void resolve_withExactKey_returnsKey() {
        String key = reconciler.register("src/app.py");

        assertThat(reconciler.resolve("SRC/App.py")).contains(key);
    }

    @Test
    void resolve_withAbsolutePathOfKnownRelativeFile_matchesBySuffix() {
        // Given
        reconciler.register("src/core/engine.py");

        // When / Then
        assertThat(reconciler.resolve("/work/repositories/demo/src/core/engine.py"))
            .contains("src/core/engine.py");
    }

    @Test
    void resolve_withRelativePathOfKnownAbsoluteFile_matchesBySuffix() {
        reconciler.register("/work/repo/src/core/engine.py");

        assertThat(reconciler.resolve("core/engine.py"))
            .contains("/work/repo/src/core/engine.py");
    }

    @Test
    void resolve_withSeveralSuffixCandidates_returnsFirstRegistered() {
        // Given
        reconciler.register("a/util.py");
        reconciler.register("b/util.py");

        // When / Then
        assertThat(reconciler.resolve("util.py")).contains("a/util.py");
    }

    @Test
    void resolve_withSuffixInsideAFileName_returnsEmpty() {
        reconciler.register("util.py");

        assertThat(reconciler.resolve("src/myutil.py")).isEmpty();
    }

    @Test
    void resolve_withKnownPathInsideADirectoryName_returnsEmpty() {
        reconciler.register("/work/mysrc/app.py");

        assertThat(reconciler.resolve("src/app.py")).isEmpty();
    }

    @Test
    void resolveExact_withSuffixOnlyMatch_returnsEmpty() {
        reconciler.register("readme.md");

        assertThat(reconciler.resolveExact("docs/README.md")).isEmpty();
        assertThat(reconciler.resolveExact("README.md")).contains("readme.md");
    }

    @Test
    void resolve_withUnknownPath_returnsEmpty() {
        reconciler.register("src/app.py");

        assertThat(reconciler.resolve("docs/readme.md")).isEmpty();
    }

    @Test
    void resolve_withBlankPath_returnsEmpty() {
        reconciler.register("src/app.py");

        assertThat(reconciler.resolve("  ")).isEmpty();
    }

    @Test
    void displayPath_returnsFirstRegisteredSpelling() {
        String key = reconciler.register("Src/App.py");
        reconciler.register("src/app.py");

        assertThat(reconciler.displayPath(key)).isEqualTo("Src/App.py");
        assertThat(reconciler.size()).isEqualTo(1);
    }
}
