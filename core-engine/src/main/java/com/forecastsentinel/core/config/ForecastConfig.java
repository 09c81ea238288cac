package com.forecastsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the forecast YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * model:
 *   type: holt_winters
 *   trend: additive
 *   seasonal: additive
 *   seasonalPeriodDuration: P1D
 * horizonDuration: P1D
 * trainPercent: 80
 * anomaly:
 *   windowSize: 24
 *   delta: 3.0
 * confidenceLevels: [25, 50, 75]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private ModelSettings model = new ModelSettings();
    private AnomalySettings anomaly = new AnomalySettings();

    /** Forecast horizon in samples; 0 when derived from {@link #horizonDuration}. */
    private int horizon;

    /** Forecast horizon as an ISO-8601 duration. */
    private String horizonDuration = "P1D";

    /** Share of the series used for training, in (0, 100]. */
    private double trainPercent = 80.0;

    /** Prediction interval levels in percent. */
    private List<Integer> confidenceLevels = new ArrayList<>();

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if any section is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (model == null) {
            errors.add("'model' section is required");
        } else {
            collect(model::validate, errors);
        }
        if (anomaly != null) {
            collect(anomaly::validate, errors);
        }
        if (horizon < 0) {
            errors.add("'horizon' must be >= 0, got: " + horizon);
        }
        if (horizon == 0) {
            if (horizonDuration == null || horizonDuration.isBlank()) {
                errors.add("Either 'horizon' or 'horizonDuration' is required");
            } else {
                try {
                    Duration.parse(horizonDuration);
                } catch (DateTimeParseException e) {
                    errors.add("'horizonDuration' is not an ISO-8601 duration: " + horizonDuration);
                }
            }
        }
        if (!(trainPercent > 0 && trainPercent <= 100)) {
            errors.add("'trainPercent' must be in (0, 100], got: " + trainPercent);
        }
        for (Integer level : getConfidenceLevels()) {
            if (level == null || level <= 0 || level >= 100) {
                errors.add("Confidence levels must be in (0, 100), got: " + level);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Forecast configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(Runnable validation, List<String> errors) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    /**
     * Resolve the forecast horizon in samples for a series sampled every
     * {@code step}.
     *
     * @param step sampling interval of the series
     * @return number of steps to forecast
     * @throws IllegalArgumentException if the horizon duration is shorter than
     *                                  one step or not a whole multiple of it
     */
    public int resolveHorizon(Duration step) {
        if (horizon > 0) {
            return horizon;
        }
        Duration duration = Duration.parse(horizonDuration);
        long durationNanos = duration.toNanos();
        long stepNanos = step.toNanos();
        if (durationNanos % stepNanos != 0) {
            throw new IllegalArgumentException(
                    "Forecast horizon " + duration + " is not a multiple of the step " + step);
        }
        long steps = durationNanos / stepNanos;
        if (steps < 1) {
            throw new IllegalArgumentException(
                    "Forecast horizon " + duration + " is shorter than the step " + step);
        }
        return Math.toIntExact(steps);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public ModelSettings getModel() {
        return model;
    }

    public void setModel(ModelSettings model) {
        this.model = model;
    }

    /**
     * @return the anomaly settings, defaults when the section was omitted
     */
    public AnomalySettings getAnomaly() {
        return anomaly != null ? anomaly : new AnomalySettings();
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly;
    }

    public int getHorizon() {
        return horizon;
    }

    public void setHorizon(int horizon) {
        this.horizon = horizon;
    }

    public String getHorizonDuration() {
        return horizonDuration;
    }

    public void setHorizonDuration(String horizonDuration) {
        this.horizonDuration = horizonDuration;
    }

    public double getTrainPercent() {
        return trainPercent;
    }

    public void setTrainPercent(double trainPercent) {
        this.trainPercent = trainPercent;
    }

    /**
     * Return the confidence levels. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of levels in percent
     */
    public List<Integer> getConfidenceLevels() {
        return confidenceLevels != null ? Collections.unmodifiableList(confidenceLevels) : List.of();
    }

    public void setConfidenceLevels(List<Integer> confidenceLevels) {
        this.confidenceLevels = confidenceLevels != null ? new ArrayList<>(confidenceLevels) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ForecastConfig{" +
                "model=" + model +
                ", anomaly=" + anomaly +
                ", horizon=" + horizon +
                ", horizonDuration='" + horizonDuration + '\'' +
                ", trainPercent=" + trainPercent +
                ", confidenceLevels=" + confidenceLevels +
                '}';
    }
}
