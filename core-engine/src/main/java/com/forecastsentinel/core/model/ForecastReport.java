package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a pipeline run produces for one series.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code modelName} and {@code forecast} are
 * required; omitting either throws a {@link NullPointerException} at build
 * time. {@code rmse} and {@code mae} stay {@code null} when the run had no
 * evaluation segment.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelName;
    private final Map<String, Object> parameters;
    private final int trainSize;
    private final int testSize;
    private final Forecast forecast;
    private final List<DataPoint> fitted;
    private final Forecast evaluationForecast;
    private final Double rmse;
    private final Double mae;
    private final List<Residual> residuals;
    private final List<AnomalyFlag> flags;

    private ForecastReport(Builder builder) {
        this.modelName = Objects.requireNonNull(builder.modelName, "modelName must not be null");
        this.forecast = Objects.requireNonNull(builder.forecast, "forecast must not be null");
        this.parameters = builder.parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters))
                : Map.of();
        this.trainSize = builder.trainSize;
        this.testSize = builder.testSize;
        this.fitted = builder.fitted != null ? List.copyOf(builder.fitted) : List.of();
        this.evaluationForecast = builder.evaluationForecast;
        this.rmse = builder.rmse;
        this.mae = builder.mae;
        this.residuals = builder.residuals != null ? List.copyOf(builder.residuals) : List.of();
        this.flags = builder.flags != null ? List.copyOf(builder.flags) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ForecastReport} instances.
     */
    public static class Builder {
        private String modelName;
        private Map<String, Object> parameters;
        private int trainSize;
        private int testSize;
        private Forecast forecast;
        private List<DataPoint> fitted;
        private Forecast evaluationForecast;
        private Double rmse;
        private Double mae;
        private List<Residual> residuals;
        private List<AnomalyFlag> flags;

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder trainSize(int trainSize) {
            this.trainSize = trainSize;
            return this;
        }

        public Builder testSize(int testSize) {
            this.testSize = testSize;
            return this;
        }

        public Builder forecast(Forecast forecast) {
            this.forecast = forecast;
            return this;
        }

        public Builder fitted(List<DataPoint> fitted) {
            this.fitted = fitted;
            return this;
        }

        public Builder evaluationForecast(Forecast evaluationForecast) {
            this.evaluationForecast = evaluationForecast;
            return this;
        }

        public Builder rmse(Double rmse) {
            this.rmse = rmse;
            return this;
        }

        public Builder mae(Double mae) {
            this.mae = mae;
            return this;
        }

        public Builder residuals(List<Residual> residuals) {
            this.residuals = residuals;
            return this;
        }

        public Builder flags(List<AnomalyFlag> flags) {
            this.flags = flags;
            return this;
        }

        public ForecastReport build() {
            return new ForecastReport(this);
        }
    }

    public String getModelName() {
        return modelName;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public int getTrainSize() {
        return trainSize;
    }

    public int getTestSize() {
        return testSize;
    }

    public Forecast getForecast() {
        return forecast;
    }

    /**
     * @return one-step-ahead predictions over the range the final model was
     *         fit on
     */
    public List<DataPoint> getFitted() {
        return fitted;
    }

    /**
     * @return the forecast over the evaluation segment, or {@code null} when
     *         the whole series was used for training
     */
    public Forecast getEvaluationForecast() {
        return evaluationForecast;
    }

    public Double getRmse() {
        return rmse;
    }

    public Double getMae() {
        return mae;
    }

    public List<Residual> getResiduals() {
        return residuals;
    }

    public List<AnomalyFlag> getFlags() {
        return flags;
    }

    @JsonProperty("anomalyCount")
    public long anomalyCount() {
        return flags.stream().filter(AnomalyFlag::isAnomalous).count();
    }

    @Override
    public String toString() {
        return "ForecastReport{" +
                "modelName='" + modelName + '\'' +
                ", trainSize=" + trainSize +
                ", testSize=" + testSize +
                ", forecast=" + forecast +
                ", rmse=" + rmse +
                ", anomalies=" + anomalyCount() +
                '}';
    }
}
