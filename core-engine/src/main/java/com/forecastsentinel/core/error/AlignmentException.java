package com.forecastsentinel.core.error;

/**
 * Thrown when a forecast and the actual values it is compared against differ
 * in length or timestamps.
 *
 * @since 1.0.0
 */
public class AlignmentException extends ForecastingException {

    private static final long serialVersionUID = 1L;

    public AlignmentException(String message) {
        super(message);
    }
}
