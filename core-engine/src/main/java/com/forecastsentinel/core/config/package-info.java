/**
 * Configuration loading and validation for Forecast Sentinel.
 *
 * <p>
 * The configuration is defined in YAML and loaded by
 * {@link com.forecastsentinel.core.config.ForecastConfigLoader} into a
 * {@link com.forecastsentinel.core.config.ForecastConfig} instance.
 * Validation runs right after parsing and reports every problem at once.
 * Configuration values are always passed explicitly to the components that
 * need them; nothing reads global state.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.config;
