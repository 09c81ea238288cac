package com.forecastsentinel.core.forecast;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fitted Holt-Winters parameters: smoothing constants plus the level, trend
 * and last seasonal cycle at the end of the training series.
 *
 * @since 1.0.0
 */
public final class HoltWintersState implements ModelState {

    private static final long serialVersionUID = 1L;

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final ComponentType trendType;
    private final ComponentType seasonalType;
    private final int period;
    private final double level;
    private final double trend;
    private final double[] season;
    private final double[] fittedValues;
    private final double residualVariance;
    private final int trainingSize;
    private final Instant lastTimestamp;
    private final Duration step;

    HoltWintersState(double alpha, double beta, double gamma,
                     ComponentType trendType, ComponentType seasonalType, int period,
                     double level, double trend, double[] season, double[] fittedValues,
                     double residualVariance, int trainingSize,
                     Instant lastTimestamp, Duration step) {
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.trendType = Objects.requireNonNull(trendType);
        this.seasonalType = Objects.requireNonNull(seasonalType);
        this.period = period;
        this.level = level;
        this.trend = trend;
        this.season = season.clone();
        this.fittedValues = fittedValues.clone();
        this.residualVariance = residualVariance;
        this.trainingSize = trainingSize;
        this.lastTimestamp = Objects.requireNonNull(lastTimestamp);
        this.step = Objects.requireNonNull(step);
    }

    public double getAlpha() {
        return alpha;
    }

    /**
     * @return the trend smoothing constant, 0 when the model has no trend
     */
    public double getBeta() {
        return beta;
    }

    /**
     * @return the seasonal smoothing constant, 0 when the model has no season
     */
    public double getGamma() {
        return gamma;
    }

    public ComponentType getTrendType() {
        return trendType;
    }

    public ComponentType getSeasonalType() {
        return seasonalType;
    }

    public int getPeriod() {
        return period;
    }

    public double getLevel() {
        return level;
    }

    public double getTrend() {
        return trend;
    }

    /**
     * @return a copy of the seasonal indices of the last training cycle
     */
    public double[] getSeason() {
        return season.clone();
    }

    /**
     * @return one-step-ahead in-sample predictions, starting after the
     *         initialization window
     */
    @Override
    public double[] getFittedValues() {
        return fittedValues.clone();
    }

    @Override
    public double getResidualVariance() {
        return residualVariance;
    }

    @Override
    public int getTrainingSize() {
        return trainingSize;
    }

    @Override
    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    @Override
    public Duration getStep() {
        return step;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("alpha", alpha);
        params.put("beta", beta);
        params.put("gamma", gamma);
        params.put("trend", trendType.name());
        params.put("seasonal", seasonalType.name());
        params.put("period", period);
        params.put("level", level);
        params.put("slope", trend);
        params.put("sigma2", residualVariance);
        return Collections.unmodifiableMap(params);
    }

    @Override
    public String toString() {
        return "HoltWintersState{" +
                "alpha=" + alpha +
                ", beta=" + beta +
                ", gamma=" + gamma +
                ", trend=" + trendType +
                ", seasonal=" + seasonalType +
                ", period=" + period +
                ", level=" + level +
                ", slope=" + trend +
                ", season=" + Arrays.toString(season) +
                '}';
    }
}
