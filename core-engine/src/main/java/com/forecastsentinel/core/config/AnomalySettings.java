package com.forecastsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling z-score detection parameters.
 *
 * @since 1.0.0
 */
public class AnomalySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Number of residuals in the rolling window, the scored one included. */
    private int windowSize = 24;

    /** Absolute z-score above which a residual is flagged. */
    private double delta = 3.0;

    /** Throw on a zero-variance window instead of flagging it. */
    private boolean strict;

    /**
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (windowSize < 1) {
            errors.add("Anomaly 'windowSize' must be >= 1, got: " + windowSize);
        }
        if (Double.isNaN(delta)) {
            errors.add("Anomaly 'delta' must be a number");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AnomalySettings: " + String.join("; ", errors));
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getDelta() {
        return delta;
    }

    public void setDelta(double delta) {
        this.delta = delta;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    @Override
    public String toString() {
        return "AnomalySettings{windowSize=" + windowSize + ", delta=" + delta + ", strict=" + strict + '}';
    }
}
