package com.forecastsentinel.core.forecast;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable parameters produced by {@link ForecastModel#fit}.
 *
 * @since 1.0.0
 */
public interface ModelState extends Serializable {

    /**
     * @return fitted parameters by name, in a stable order, for reporting
     */
    Map<String, Object> parameters();

    /**
     * @return variance of the in-sample one-step prediction errors
     */
    double getResidualVariance();

    /**
     * @return one-step-ahead in-sample predictions for the last
     *         {@code length} training points, oldest first; the points
     *         consumed by initialization have none
     */
    double[] getFittedValues();

    int getTrainingSize();

    Instant getLastTimestamp();

    Duration getStep();
}
