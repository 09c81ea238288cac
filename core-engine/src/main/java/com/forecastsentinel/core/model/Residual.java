package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Forecast error at one timestamp: {@code error = actual - predicted}.
 *
 * @since 1.0.0
 */
public final class Residual implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double actual;
    private final double predicted;

    public Residual(Instant timestamp, double actual, double predicted) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.actual = actual;
        this.predicted = predicted;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getActual() {
        return actual;
    }

    public double getPredicted() {
        return predicted;
    }

    public double getError() {
        return actual - predicted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Residual that))
            return false;
        return Double.compare(actual, that.actual) == 0
                && Double.compare(predicted, that.predicted) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, actual, predicted);
    }

    @Override
    public String toString() {
        return "Residual{" + timestamp + ", actual=" + actual + ", predicted=" + predicted + '}';
    }
}
