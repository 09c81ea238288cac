package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.config.ModelSettings;
import com.forecastsentinel.core.error.InsufficientDataException;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.PredictionInterval;
import com.forecastsentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HoltWintersModel}.
 */
class HoltWintersModelTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private static ModelSettings settings(String trend, String seasonal) {
        ModelSettings settings = new ModelSettings();
        settings.setType(ModelSettings.HOLT_WINTERS);
        settings.setTrend(trend);
        settings.setSeasonal(seasonal);
        return settings;
    }

    @Test
    @DisplayName("Should forecast a constant series as that constant")
    void shouldForecastConstant() {
        double[] values = new double[30];
        Arrays.fill(values, 5.0);
        HoltWintersModel model = new HoltWintersModel(settings("none", "none"), 0);

        model.fit(Series.of(START, HOUR, values));
        Forecast forecast = model.forecast(10);

        assertThat(forecast.size()).isEqualTo(10);
        for (int h = 0; h < 10; h++) {
            assertThat(forecast.valueAt(h)).isCloseTo(5.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should extrapolate a noise-free linear trend exactly")
    void shouldExtrapolateLinearTrend() {
        double[] values = new double[50];
        for (int t = 0; t < values.length; t++) {
            values[t] = 2 + 0.5 * t;
        }
        HoltWintersModel model = new HoltWintersModel(settings("additive", "none"), 0);

        model.fit(Series.of(START, HOUR, values));
        Forecast forecast = model.forecast(5);

        for (int h = 1; h <= 5; h++) {
            assertThat(forecast.valueAt(h - 1)).isCloseTo(2 + 0.5 * (49 + h), within(1e-6));
        }
    }

    @Test
    @DisplayName("Should reproduce an additive seasonal pattern on a trend")
    void shouldReproduceAdditiveSeason() {
        double[] season = {1, -1, -1, 1};
        double[] values = new double[40];
        for (int t = 0; t < values.length; t++) {
            values[t] = 10 + 0.1 * t + season[t % 4];
        }
        HoltWintersModel model = new HoltWintersModel(settings("additive", "additive"), 4);

        model.fit(Series.of(START, HOUR, values));
        Forecast forecast = model.forecast(8);

        for (int h = 1; h <= 8; h++) {
            int t = 39 + h;
            assertThat(forecast.valueAt(h - 1)).isCloseTo(10 + 0.1 * t + season[t % 4], within(1e-6));
        }
    }

    @Test
    @DisplayName("Should reproduce a multiplicative seasonal pattern")
    void shouldReproduceMultiplicativeSeason() {
        double[] factors = {1.2, 0.8, 0.8, 1.2};
        double[] values = new double[24];
        for (int t = 0; t < values.length; t++) {
            values[t] = 50 * factors[t % 4];
        }
        HoltWintersModel model = new HoltWintersModel(settings("none", "multiplicative"), 4);

        model.fit(Series.of(START, HOUR, values));
        Forecast forecast = model.forecast(4);

        assertThat(forecast.valueAt(0)).isCloseTo(60, within(1e-6));
        assertThat(forecast.valueAt(1)).isCloseTo(40, within(1e-6));
        assertThat(forecast.valueAt(2)).isCloseTo(40, within(1e-6));
        assertThat(forecast.valueAt(3)).isCloseTo(60, within(1e-6));
    }

    @Test
    @DisplayName("Should start the forecast one step after the training data")
    void shouldPlaceForecastAfterTraining() {
        Series train = Series.of(START, HOUR, 1, 2, 3, 4, 5, 6);
        HoltWintersModel model = new HoltWintersModel(settings("additive", "none"), 0);

        model.fit(train);
        Forecast forecast = model.forecast(3);

        assertThat(forecast.getPoints().get(0).getTimestamp()).isEqualTo(train.timestampAfterEnd(1));
        assertThat(forecast.getPoints().get(2).getTimestamp()).isEqualTo(train.timestampAfterEnd(3));
    }

    @Test
    @DisplayName("Should keep configured smoothing constants and optimize the rest within bounds")
    void shouldHonourFixedConstants() {
        ModelSettings settings = settings("additive", "additive");
        settings.setAlpha(0.3);
        HoltWintersModel model = new HoltWintersModel(settings, 12);

        HoltWintersState state = (HoltWintersState) model.fit(noisySeasonal(120, 12, 7L));

        assertThat(state.getAlpha()).isEqualTo(0.3);
        assertThat(state.getBeta()).isBetween(HoltWintersModel.MIN_SMOOTHING, HoltWintersModel.MAX_SMOOTHING);
        assertThat(state.getGamma()).isBetween(HoltWintersModel.MIN_SMOOTHING, HoltWintersModel.MAX_SMOOTHING);
        assertThat(state.getSeason()).hasSize(12);
        assertThat(state.getFittedValues()).hasSize(120 - 12);
        assertThat(state.getResidualVariance()).isPositive();
    }

    @Test
    @DisplayName("Should widen prediction intervals with the horizon and the confidence level")
    void shouldProduceNestedIntervals() {
        HoltWintersModel model = new HoltWintersModel(settings("additive", "additive"), 12);
        model.fit(noisySeasonal(120, 12, 11L));

        Forecast forecast = model.forecast(24, List.of(80, 95));
        List<PredictionInterval> narrow = forecast.intervalsAt(80);
        List<PredictionInterval> wide = forecast.intervalsAt(95);

        assertThat(narrow).hasSize(24);
        assertThat(wide).hasSize(24);
        for (int h = 0; h < 24; h++) {
            double value = forecast.valueAt(h);
            assertThat(narrow.get(h).getLower()).isLessThan(value);
            assertThat(narrow.get(h).getUpper()).isGreaterThan(value);
            assertThat(wide.get(h).getLower()).isLessThan(narrow.get(h).getLower());
            assertThat(wide.get(h).getUpper()).isGreaterThan(narrow.get(h).getUpper());
        }
        double firstWidth = narrow.get(0).getUpper() - narrow.get(0).getLower();
        double lastWidth = narrow.get(23).getUpper() - narrow.get(23).getLower();
        assertThat(lastWidth).isGreaterThan(firstWidth);
    }

    @Test
    @DisplayName("Should require two full seasonal periods")
    void shouldRequireTwoPeriods() {
        HoltWintersModel model = new HoltWintersModel(settings("additive", "additive"), 24);

        assertThatThrownBy(() -> model.fit(noisySeasonal(47, 24, 1L)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> assertThat(((InsufficientDataException) e).getRequired()).isEqualTo(48));
    }

    @Test
    @DisplayName("Should reject non-positive values for multiplicative seasonality")
    void shouldRejectNonPositiveMultiplicative() {
        double[] values = {5, 4, 3, 2, 1, 0, 1, 2};
        Series series = Series.of(START, HOUR, values);
        HoltWintersModel model = new HoltWintersModel(settings("none", "multiplicative"), 2);

        assertThatThrownBy(() -> model.fit(series))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly positive")
                .hasMessageContaining(series.timestampAt(5).toString());
    }

    @Test
    @DisplayName("Should refuse to forecast before fitting")
    void shouldRequireFit() {
        HoltWintersModel model = new HoltWintersModel(settings("none", "none"), 0);

        assertThat(model.getState()).isEmpty();
        assertThatThrownBy(() -> model.forecast(3)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a horizon below one")
    void shouldRejectZeroHorizon() {
        HoltWintersModel model = new HoltWintersModel(settings("none", "none"), 0);
        model.fit(Series.of(START, HOUR, 1, 2, 3, 4));

        assertThatThrownBy(() -> model.forecast(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject seasonality without a usable period")
    void shouldRejectMissingPeriod() {
        assertThatThrownBy(() -> new HoltWintersModel(settings("additive", "additive"), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static Series noisySeasonal(int size, int period, long seed) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int t = 0; t < size; t++) {
            values[t] = 100 + 0.2 * t + 10 * Math.sin(2 * Math.PI * t / period) + random.nextGaussian();
        }
        return Series.of(START, HOUR, values);
    }
}
