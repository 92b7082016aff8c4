package com.repoforensics.core.engine;

import com.repoforensics.core.model.Signal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Normalizer}.
 */
class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    void normalize_scalesByMaximumPerSignal() {
        // Given
        DeveloperMetrics alice = new DeveloperMetrics("alice");
        alice.add(Signal.COMMITS, 100);
        DeveloperMetrics bob = new DeveloperMetrics("bob");
        bob.add(Signal.COMMITS, 25);
        bob.add(Signal.OWNERSHIP, 2.0);

        // When
        List<ScoredDeveloper> scored = normalizer.normalize(List.of(alice, bob));

        // Then
        assertThat(scored.get(0).normalized(Signal.COMMITS)).isEqualTo(100.0);
        assertThat(scored.get(1).normalized(Signal.COMMITS)).isEqualTo(25.0);
        assertThat(scored.get(0).normalized(Signal.OWNERSHIP)).isZero();
        assertThat(scored.get(1).normalized(Signal.OWNERSHIP)).isEqualTo(100.0);
    }

    @Test
    void normalize_withAllZeroSignal_returnsZeroForEveryone() {
        DeveloperMetrics alice = new DeveloperMetrics("alice");
        DeveloperMetrics bob = new DeveloperMetrics("bob");

        List<ScoredDeveloper> scored = normalizer.normalize(List.of(alice, bob));

        for (ScoredDeveloper developer : scored) {
            for (Signal signal : Signal.values()) {
                assertThat(developer.normalized(signal)).isZero();
            }
        }
    }

    @Test
    void normalize_withNoDevelopers_returnsEmptyList() {
        assertThat(normalizer.normalize(List.of())).isEmpty();
    }

    @Test
    void normalize_keepsValuesWithinZeroToHundred() {
        DeveloperMetrics a = new DeveloperMetrics("a");
        a.add(Signal.RECENCY, 0.5);
        DeveloperMetrics b = new DeveloperMetrics("b");
        b.add(Signal.RECENCY, 37.5);

        List<ScoredDeveloper> scored = normalizer.normalize(List.of(a, b));

        assertThat(scored).allSatisfy(d -> assertThat(d.normalized(Signal.RECENCY)).isBetween(0.0, 100.0));
    }

    @Test
    void normalize_withNonPositiveMax_returnsZero() {
        assertThat(Normalizer.normalize(0.0, 0.0)).isZero();
        assertThat(Normalizer.normalize(5.0, 10.0)).isEqualTo(50.0);
    }
}
