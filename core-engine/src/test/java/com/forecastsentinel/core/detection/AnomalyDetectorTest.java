package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.error.DegenerateWindowException;
import com.forecastsentinel.core.model.AnomalyFlag;
import com.forecastsentinel.core.model.Residual;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final int SPIKE_INDEX = 20;
    // (n - 1) / sqrt(n) for a single spike in a window of n = 10
    private static final double SPIKE_Z = 9 / Math.sqrt(10);

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector();
    }

    @Test
    @DisplayName("Should emit one flag per residual")
    void shouldEmitOneFlagPerResidual() {
        List<Residual> residuals = residuals(1, -1, 1, -1, 1, -1, 1);

        List<AnomalyFlag> flags = detector.detect(residuals, 3, 2.0);

        assertThat(flags).hasSize(residuals.size());
        for (int i = 0; i < flags.size(); i++) {
            assertThat(flags.get(i).getTimestamp()).isEqualTo(residuals.get(i).getTimestamp());
        }
    }

    @Test
    @DisplayName("Should score the first residual against itself alone")
    void shouldNotFlagFirstResidual() {
        List<AnomalyFlag> flags = detector.detect(residuals(0, 1000, -1000), 5, 0.1);

        assertThat(flags.get(0).getZScore()).isZero();
        assertThat(flags.get(0).isAnomalous()).isFalse();
        assertThat(flags.get(0).getRollingMean()).isZero();
    }

    @Test
    @DisplayName("Should shrink the window to the residuals seen so far")
    void shouldShrinkWindowDuringWarmUp() {
        List<AnomalyFlag> flags = detector.detect(residuals(0, 1000, -1000), 5, 0.1);

        // window [0, 1000]: mean 500, sample std 500 * sqrt(2)
        assertThat(flags.get(1).getRollingMean()).isEqualTo(500.0);
        assertThat(flags.get(1).getZScore()).isCloseTo(1 / Math.sqrt(2), within(1e-12));
        assertThat(flags.get(1).isAnomalous()).isTrue();
    }

    @Test
    @DisplayName("Should include the current residual in its own window")
    void shouldIncludeCurrentResidual() {
        List<AnomalyFlag> flags = detector.detect(residuals(2, 4, 100), 10, 1.0);

        assertThat(flags.get(2).getRollingMean()).isCloseTo(106.0 / 3.0, within(1e-12));
    }

    @Test
    @DisplayName("Should drop residuals that fall out of the window")
    void shouldBoundWindow() {
        List<AnomalyFlag> flags = detector.detect(residuals(100, 0, 0, 0), 3, 1.0);

        assertThat(flags.get(3).getRollingMean()).isZero();
        assertThat(flags.get(3).getRollingStd()).isZero();
        assertThat(flags.get(3).getZScore()).isZero();
    }

    @Test
    @DisplayName("Should flag exactly the spike on a constant series when delta is below its z-score")
    void shouldFlagSpikeOnConstantSeries() {
        List<AnomalyFlag> flags = detector.detect(residuals(constantWithSpike()), 10, 2.0);

        for (int i = 0; i < flags.size(); i++) {
            assertThat(flags.get(i).isAnomalous()).as("index %d", i).isEqualTo(i == SPIKE_INDEX);
        }
        // nine zeros and the spike: mean 1, sample std sqrt(10)
        AnomalyFlag spike = flags.get(SPIKE_INDEX);
        assertThat(spike.getRollingMean()).isCloseTo(1.0, within(1e-12));
        assertThat(spike.getRollingStd()).isCloseTo(Math.sqrt(10), within(1e-12));
        assertThat(spike.getZScore()).isCloseTo(SPIKE_Z, within(1e-12));
    }

    @Test
    @DisplayName("Should flag nothing on a constant series when delta is above the spike's z-score")
    void shouldNotFlagSpikeBelowDelta() {
        List<AnomalyFlag> flags = detector.detect(residuals(constantWithSpike()), 10, SPIKE_Z + 0.01);

        assertThat(flags).noneMatch(AnomalyFlag::isAnomalous);
        assertThat(flags.get(SPIKE_INDEX).getZScore()).isFinite();
    }

    @Test
    @DisplayName("Should score a window of identical residuals as zero")
    void shouldScoreConstantWindowAsZero() {
        List<AnomalyFlag> flags = detector.detect(residuals(5, 5, 5, 5, 5), 3, 0.0);

        assertThat(flags).allSatisfy(flag -> {
            assertThat(flag.getZScore()).isZero();
            assertThat(flag.isAnomalous()).isFalse();
        });
    }

    @Test
    @DisplayName("Should flag with an infinite z-score when the standard deviation underflows")
    void shouldFlagDegenerateWindow() {
        // squared deviations of 5e-171 underflow to zero
        List<AnomalyFlag> flags = detector.detect(residuals(0, 1e-170), 2, 3.0);

        AnomalyFlag flag = flags.get(1);
        assertThat(flag.getRollingStd()).isZero();
        assertThat(flag.getZScore()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(flag.isAnomalous()).isTrue();
    }

    @Test
    @DisplayName("Should match the sign of the deviation on a degenerate window")
    void shouldSignMatchDegenerateWindow() {
        List<AnomalyFlag> flags = detector.detect(residuals(0, -1e-170), 2, 3.0);

        assertThat(flags.get(1).getZScore()).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("Should throw on a degenerate window in strict mode")
    void shouldThrowInStrictMode() {
        AnomalyDetector strict = new AnomalyDetector(true);
        List<Residual> residuals = residuals(0, 1e-170);

        assertThatThrownBy(() -> strict.detect(residuals, 2, 3.0))
                .isInstanceOf(DegenerateWindowException.class)
                .satisfies(e -> assertThat(((DegenerateWindowException) e).getTimestamp())
                        .isEqualTo(residuals.get(1).getTimestamp()));
    }

    @Test
    @DisplayName("Should not throw in strict mode on a constant series")
    void shouldAcceptConstantSeriesInStrictMode() {
        AnomalyDetector strict = new AnomalyDetector(true);

        assertThat(strict.detect(residuals(7, 7, 7, 7), 3, 3.0)).noneMatch(AnomalyFlag::isAnomalous);
    }

    @Test
    @DisplayName("Should reject a window size below one")
    void shouldRejectInvalidWindowSize() {
        assertThatThrownBy(() -> detector.detect(residuals(1, 2, 3), 0, 3.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should return no flags for no residuals")
    void shouldHandleEmptyInput() {
        assertThat(detector.detect(List.of(), 5, 3.0)).isEmpty();
    }

    private static double[] constantWithSpike() {
        double[] values = new double[30];
        values[SPIKE_INDEX] = 10;
        return values;
    }

    private static List<Residual> residuals(double... errors) {
        List<Residual> residuals = new ArrayList<>(errors.length);
        for (int i = 0; i < errors.length; i++) {
            residuals.add(new Residual(START.plus(Duration.ofHours(i)), errors[i], 0.0));
        }
        return residuals;
    }
}
