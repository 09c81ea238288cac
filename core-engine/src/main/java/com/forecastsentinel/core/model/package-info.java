/**
 * Domain model classes for Forecast Sentinel.
 *
 * <p>
 * Every class in this package is immutable:
 * </p>
 * <ul>
 * <li>{@link com.forecastsentinel.core.model.Series}: regularly sampled
 * input, possibly with gaps</li>
 * <li>{@link com.forecastsentinel.core.model.Forecast}: predicted values and
 * optional prediction intervals</li>
 * <li>{@link com.forecastsentinel.core.model.Residual} and
 * {@link com.forecastsentinel.core.model.AnomalyFlag}: evaluation
 * output</li>
 * <li>{@link com.forecastsentinel.core.model.ForecastReport}: aggregate
 * result of a pipeline run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.model;
