package com.forecastsentinel.core.error;

/**
 * Thrown when a series has too few points (or too few known values) to fill,
 * initialize or fit.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends ForecastingException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int available;

    /**
     * For conditions without a meaningful point count; {@link #getRequired()}
     * and {@link #getAvailable()} return {@code -1}.
     */
    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
        this.required = -1;
        this.available = -1;
    }

    public InsufficientDataException(String message, int required, int available) {
        super(message + " (required: " + required + ", available: " + available + ")");
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
