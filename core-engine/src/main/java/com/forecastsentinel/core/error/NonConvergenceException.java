package com.forecastsentinel.core.error;

/**
 * Thrown when an iterative estimator exhausts its iteration budget or fails
 * to reduce the residual variance.
 *
 * @since 1.0.0
 */
public class NonConvergenceException extends ForecastingException {

    private static final long serialVersionUID = 1L;

    public NonConvergenceException(String message) {
        super(message);
    }

    public NonConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
