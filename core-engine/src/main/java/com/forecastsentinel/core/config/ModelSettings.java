package com.forecastsentinel.core.config;

import com.forecastsentinel.core.forecast.ComponentType;
import com.forecastsentinel.core.preprocessing.SeasonalPeriod;

import java.io.Serializable;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes which forecasting model to build and how.
 *
 * <p>
 * Supported model types:
 * </p>
 * <ul>
 * <li>{@code holt_winters}: triple exponential smoothing</li>
 * <li>{@code arima}: autoregressive integrated moving average, optionally
 * with seasonal lags</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all fields required by the declared type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String HOLT_WINTERS = "holt_winters";
    public static final String ARIMA = "arima";

    /** Model type: "holt_winters" or "arima". */
    private String type;

    // --- Seasonality (both models) ---
    /** Samples per seasonal cycle; 0 when derived from the duration or unused. */
    private int seasonalPeriod;

    /** Seasonal cycle as an ISO-8601 duration, e.g. {@code P1D}. */
    private String seasonalPeriodDuration;

    // --- Holt-Winters fields ---
    private String trend = "additive";
    private String seasonal = "additive";

    /** Fixed smoothing constants; {@code null} means optimized during fit. */
    private Double alpha;
    private Double beta;
    private Double gamma;

    // --- ARIMA fields ---
    private int p;
    private int d;
    private int q;
    private int seasonalP;
    private int seasonalD;
    private int seasonalQ;

    /** Iteration budget of the iterative estimators. */
    private int maxIterations = 500;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields required by the declared model type are
     * present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (type == null || type.isBlank()) {
            errors.add("Model 'type' is required");
        }
        if (maxIterations < 1) {
            errors.add("Model 'maxIterations' must be >= 1");
        }
        if (seasonalPeriod < 0) {
            errors.add("Model 'seasonalPeriod' must be >= 0");
        } else if (seasonalPeriod == 1) {
            errors.add("Model 'seasonalPeriod' must be >= " + SeasonalPeriod.MIN_SAMPLES);
        }
        if (seasonalPeriodDuration != null && !seasonalPeriodDuration.isBlank()) {
            try {
                Duration.parse(seasonalPeriodDuration);
            } catch (DateTimeParseException e) {
                errors.add("Model 'seasonalPeriodDuration' is not an ISO-8601 duration: "
                        + seasonalPeriodDuration);
            }
        }

        if (type != null) {
            switch (type) {
                case HOLT_WINTERS -> validateHoltWinters(errors);
                case ARIMA -> validateArima(errors);
                default -> errors.add("Unknown model type: '" + type
                        + "'. Supported: " + HOLT_WINTERS + ", " + ARIMA);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ModelSettings: " + String.join("; ", errors));
        }
    }

    private void validateHoltWinters(List<String> errors) {
        ComponentType seasonalType = null;
        try {
            ComponentType.fromString(trend);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            seasonalType = ComponentType.fromString(seasonal);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (seasonalType != null && seasonalType != ComponentType.NONE && !hasSeasonalPeriod()) {
            errors.add("Seasonal Holt-Winters requires 'seasonalPeriod' or 'seasonalPeriodDuration'");
        }
        checkSmoothing("alpha", alpha, errors);
        checkSmoothing("beta", beta, errors);
        checkSmoothing("gamma", gamma, errors);
    }

    private void validateArima(List<String> errors) {
        if (p < 0 || d < 0 || q < 0) {
            errors.add("ARIMA orders (p, d, q) must be >= 0, got: (" + p + ", " + d + ", " + q + ")");
        }
        if (seasonalP < 0 || seasonalD < 0 || seasonalQ < 0) {
            errors.add("Seasonal ARIMA orders (P, D, Q) must be >= 0, got: ("
                    + seasonalP + ", " + seasonalD + ", " + seasonalQ + ")");
        }
        if (hasSeasonalOrder() && !hasSeasonalPeriod()) {
            errors.add("Seasonal ARIMA orders require 'seasonalPeriod' or 'seasonalPeriodDuration'");
        }
    }

    private static void checkSmoothing(String name, Double value, List<String> errors) {
        if (value != null && !(value > 0 && value < 1)) {
            errors.add("Holt-Winters '" + name + "' must be in (0, 1), got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public boolean hasSeasonalPeriod() {
        return seasonalPeriod > 0
                || (seasonalPeriodDuration != null && !seasonalPeriodDuration.isBlank());
    }

    public boolean hasSeasonalOrder() {
        return seasonalP > 0 || seasonalD > 0 || seasonalQ > 0;
    }

    /**
     * Resolve the seasonal period in samples for a series sampled every
     * {@code step}.
     *
     * @param step sampling interval of the series
     * @return samples per cycle, or 0 when no period is configured
     * @throws IllegalArgumentException if the duration does not map onto a
     *                                  whole number of at least two samples
     */
    public int resolveSeasonalPeriod(Duration step) {
        if (seasonalPeriod > 0) {
            return seasonalPeriod;
        }
        if (seasonalPeriodDuration != null && !seasonalPeriodDuration.isBlank()) {
            return SeasonalPeriod.samples(Duration.parse(seasonalPeriodDuration), step);
        }
        return 0;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    /**
     * Set the model type, normalised to lowercase.
     *
     * @param type model type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public void setSeasonalPeriod(int seasonalPeriod) {
        this.seasonalPeriod = seasonalPeriod;
    }

    public String getSeasonalPeriodDuration() {
        return seasonalPeriodDuration;
    }

    public void setSeasonalPeriodDuration(String seasonalPeriodDuration) {
        this.seasonalPeriodDuration = seasonalPeriodDuration;
    }

    public String getTrend() {
        return trend;
    }

    public void setTrend(String trend) {
        this.trend = trend;
    }

    public String getSeasonal() {
        return seasonal;
    }

    public void setSeasonal(String seasonal) {
        this.seasonal = seasonal;
    }

    public Double getAlpha() {
        return alpha;
    }

    public void setAlpha(Double alpha) {
        this.alpha = alpha;
    }

    public Double getBeta() {
        return beta;
    }

    public void setBeta(Double beta) {
        this.beta = beta;
    }

    public Double getGamma() {
        return gamma;
    }

    public void setGamma(Double gamma) {
        this.gamma = gamma;
    }

    public int getP() {
        return p;
    }

    public void setP(int p) {
        this.p = p;
    }

    public int getD() {
        return d;
    }

    public void setD(int d) {
        this.d = d;
    }

    public int getQ() {
        return q;
    }

    public void setQ(int q) {
        this.q = q;
    }

    public int getSeasonalP() {
        return seasonalP;
    }

    public void setSeasonalP(int seasonalP) {
        this.seasonalP = seasonalP;
    }

    public int getSeasonalD() {
        return seasonalD;
    }

    public void setSeasonalD(int seasonalD) {
        this.seasonalD = seasonalD;
    }

    public int getSeasonalQ() {
        return seasonalQ;
    }

    public void setSeasonalQ(int seasonalQ) {
        this.seasonalQ = seasonalQ;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelSettings that))
            return false;
        return seasonalPeriod == that.seasonalPeriod
                && p == that.p && d == that.d && q == that.q
                && seasonalP == that.seasonalP && seasonalD == that.seasonalD && seasonalQ == that.seasonalQ
                && maxIterations == that.maxIterations
                && Objects.equals(type, that.type)
                && Objects.equals(seasonalPeriodDuration, that.seasonalPeriodDuration)
                && Objects.equals(trend, that.trend)
                && Objects.equals(seasonal, that.seasonal)
                && Objects.equals(alpha, that.alpha)
                && Objects.equals(beta, that.beta)
                && Objects.equals(gamma, that.gamma);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, seasonalPeriod, seasonalPeriodDuration, trend, seasonal,
                alpha, beta, gamma, p, d, q, seasonalP, seasonalD, seasonalQ, maxIterations);
    }

    @Override
    public String toString() {
        return "ModelSettings{" +
                "type='" + type + '\'' +
                ", seasonalPeriod=" + seasonalPeriod +
                ", seasonalPeriodDuration='" + seasonalPeriodDuration + '\'' +
                ", trend='" + trend + '\'' +
                ", seasonal='" + seasonal + '\'' +
                ", alpha=" + alpha +
                ", beta=" + beta +
                ", gamma=" + gamma +
                ", order=(" + p + ", " + d + ", " + q + ")" +
                ", seasonalOrder=(" + seasonalP + ", " + seasonalD + ", " + seasonalQ + ")" +
                ", maxIterations=" + maxIterations +
                '}';
    }
}
