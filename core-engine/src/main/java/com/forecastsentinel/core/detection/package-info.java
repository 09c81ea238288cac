/**
 * Anomaly detection on forecast residuals.
 *
 * <p>
 * {@link com.forecastsentinel.core.detection.AnomalyDetector} flags residuals
 * whose rolling z-score exceeds a threshold, moving average ± delta × σ.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.detection;
