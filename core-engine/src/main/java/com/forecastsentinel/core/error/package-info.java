/**
 * Domain errors raised by the forecasting and detection engine.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.error;
