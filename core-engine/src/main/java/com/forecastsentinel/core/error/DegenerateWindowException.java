package com.forecastsentinel.core.error;

import java.time.Instant;

/**
 * Thrown by a strict anomaly detector when a rolling window has zero standard
 * deviation but the residual deviates from the window mean.
 *
 * <p>
 * The default detector does not throw this; it reports the point as an
 * anomaly with an infinite z-score instead.
 * </p>
 *
 * @since 1.0.0
 */
public class DegenerateWindowException extends ForecastingException {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;

    public DegenerateWindowException(Instant timestamp, double residual, double rollingMean) {
        super("Zero-variance window at " + timestamp + ": residual=" + residual
                + " deviates from constant window mean " + rollingMean);
        this.timestamp = timestamp;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
