package com.forecastsentinel.core.preprocessing;

import com.forecastsentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Splitter}.
 */
class SplitterTest {

    private static final Series SERIES = Series.of(
            Instant.parse("2024-01-01T00:00:00Z"), Duration.ofHours(1),
            0, 1, 2, 3, 4, 5, 6, 7, 8, 9);

    @Test
    @DisplayName("Should split chronologically with the floor of the share")
    void shouldSplitByFloor() {
        SplitSeries split = Splitter.split(SERIES, 75);

        assertThat(split.getTrain().size()).isEqualTo(7);
        assertThat(split.getTest().size()).isEqualTo(3);
        assertThat(split.getTrain().values()).startsWith(0, 1, 2);
        assertThat(split.getTest().values()).containsExactly(7, 8, 9);
        assertThat(split.hasTest()).isTrue();
    }

    @Test
    @DisplayName("Should leave the test segment empty at 100 percent")
    void shouldKeepEverythingForTraining() {
        SplitSeries split = Splitter.split(SERIES, 100);

        assertThat(split.getTrain()).isEqualTo(SERIES);
        assertThat(split.getTest().isEmpty()).isTrue();
        assertThat(split.hasTest()).isFalse();
    }

    @Test
    @DisplayName("Should reject shares outside (0, 100]")
    void shouldRejectInvalidShares() {
        assertThatThrownBy(() -> Splitter.split(SERIES, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Splitter.split(SERIES, 100.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Splitter.split(SERIES, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
