/**
 * Forecast accuracy: RMSE, MAE and residual series against held-out
 * actuals.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.evaluation;
