package com.forecastsentinel.core.error;

/**
 * Base class of the engine's domain errors.
 *
 * <p>
 * All engine operations are deterministic computations over data that is
 * already in memory, so none of these errors is retryable: they are surfaced
 * to the caller as soon as they occur and no partial result is returned.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ForecastingException(String message) {
        super(message);
    }

    public ForecastingException(String message, Throwable cause) {
        super(message, cause);
    }
}
