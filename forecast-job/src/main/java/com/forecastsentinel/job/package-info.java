/**
 * Batch entry point: reads a JSON series document, runs the forecast
 * pipeline and writes a JSON report.
 *
 * <p>
 * Main class: {@link com.forecastsentinel.job.ForecastJob}. All wiring is
 * configured via environment variables, see
 * {@link com.forecastsentinel.job.JobConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.job;
