package com.forecastsentinel.core.evaluation;

import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.Residual;
import com.forecastsentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Evaluator}.
 */
class EvaluatorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    @Test
    @DisplayName("Should compute the root mean squared error")
    void shouldComputeRmse() {
        Series actual = Series.of(START, HOUR, 1, 2, 3, 4);
        Forecast forecast = forecast(START, 2, 2, 5, 4);

        // errors 1, 0, 2, 0 -> sqrt(5 / 4)
        assertThat(Evaluator.rmse(forecast, actual)).isCloseTo(Math.sqrt(1.25), within(1e-12));
        assertThat(Evaluator.mae(forecast, actual)).isCloseTo(0.75, within(1e-12));
    }

    @Test
    @DisplayName("Should be zero for a perfect forecast")
    void shouldBeZeroForPerfectForecast() {
        Series actual = Series.of(START, HOUR, 3, 1, 4);

        assertThat(Evaluator.rmse(forecast(START, 3, 1, 4), actual)).isZero();
    }

    @Test
    @DisplayName("Should be symmetric in its arguments")
    void shouldBeSymmetric() {
        List<DataPoint> a = Series.of(START, HOUR, 1, 5, 2).getPoints();
        List<DataPoint> b = Series.of(START, HOUR, 4, 4, 0).getPoints();

        assertThat(Evaluator.rmse(a, b)).isEqualTo(Evaluator.rmse(b, a));
    }

    @Test
    @DisplayName("Should reject inputs of different length")
    void shouldRejectLengthMismatch() {
        Series actual = Series.of(START, HOUR, 1, 2, 3);

        assertThatThrownBy(() -> Evaluator.rmse(forecast(START, 1, 2), actual))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("Length mismatch");
    }

    @Test
    @DisplayName("Should reject misaligned timestamps")
    void shouldRejectTimestampMismatch() {
        Series actual = Series.of(START, HOUR, 1, 2);

        assertThatThrownBy(() -> Evaluator.rmse(forecast(START.plus(HOUR), 1, 2), actual))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("Timestamp mismatch");
    }

    @Test
    @DisplayName("Should reject empty inputs")
    void shouldRejectEmpty() {
        Series actual = new Series(HOUR, List.of());

        assertThatThrownBy(() -> Evaluator.rmse(new Forecast(List.of()), actual))
                .isInstanceOf(AlignmentException.class);
    }

    @Test
    @DisplayName("Should compute residuals as actual minus predicted")
    void shouldComputeResiduals() {
        Series actual = Series.of(START, HOUR, 10, 20);

        List<Residual> residuals = Evaluator.residuals(actual, forecast(START, 12, 15));

        assertThat(residuals).hasSize(2);
        assertThat(residuals.get(0).getError()).isEqualTo(-2.0);
        assertThat(residuals.get(1).getError()).isEqualTo(5.0);
        assertThat(residuals.get(1).getTimestamp()).isEqualTo(START.plus(HOUR));
    }

    private static Forecast forecast(Instant start, double... values) {
        return new Forecast(Series.of(start, HOUR, values).getPoints());
    }
}
