package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.Series;

import java.util.List;
import java.util.Optional;

/**
 * Contract for all forecasting models.
 * <p>
 * A model has two phases. {@link #fit(Series)} consumes a gap-free training
 * series and produces an immutable {@link ModelState}; {@link #forecast(int)}
 * is then a pure function of that state and can be called any number of
 * times. Fitting again replaces the state.
 * </p>
 * <p>
 * Instances are not thread-safe and must not be shared between concurrent
 * callers; independent instances share nothing.
 * </p>
 */
public interface ForecastModel {

    /**
     * Fit the model to a training series.
     *
     * @param train gap-free training series
     * @return the fitted state
     * @throws com.forecastsentinel.core.error.InsufficientDataException if the
     *         series is too short for this model
     * @throws com.forecastsentinel.core.error.NonConvergenceException   if an
     *         iterative estimator exhausts its budget
     */
    ModelState fit(Series train);

    /**
     * Forecast {@code horizon} steps past the end of the training series.
     *
     * @param horizon number of steps; must be &gt;= 1
     * @return exactly {@code horizon} predicted points
     * @throws IllegalStateException if the model has not been fit
     */
    default Forecast forecast(int horizon) {
        return forecast(horizon, List.of());
    }

    /**
     * Forecast {@code horizon} steps and attach prediction intervals for each
     * confidence level (in percent).
     *
     * @param horizon          number of steps; must be &gt;= 1
     * @param confidenceLevels levels in (0, 100), possibly empty
     * @return exactly {@code horizon} predicted points
     * @throws IllegalStateException if the model has not been fit
     */
    Forecast forecast(int horizon, List<Integer> confidenceLevels);

    /**
     * @return the fitted state, or empty before {@link #fit(Series)}
     */
    Optional<ModelState> getState();

    /**
     * @return the model type name used in configuration and reports
     */
    String getModelName();
}
