/**
 * Forecasting models.
 *
 * <p>
 * Every model implements {@link com.forecastsentinel.core.forecast.ForecastModel}
 * and is created through {@link com.forecastsentinel.core.forecast.ModelFactory}.
 * Two families are provided:
 * </p>
 * <ul>
 * <li>{@link com.forecastsentinel.core.forecast.HoltWintersModel}: exponential
 * smoothing with optional additive or multiplicative trend and season</li>
 * <li>{@link com.forecastsentinel.core.forecast.ArimaModel}: ARIMA with
 * optional seasonal lags, estimated by conditional sum of squares</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.forecast;
