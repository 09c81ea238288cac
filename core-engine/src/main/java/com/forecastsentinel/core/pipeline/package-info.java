/**
 * Orchestration of preprocessing, forecasting, evaluation and anomaly
 * detection for a single series.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.pipeline;
