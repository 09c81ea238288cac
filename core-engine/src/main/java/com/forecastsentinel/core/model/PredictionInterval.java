package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Lower and upper bound of a forecast at one timestamp for a given
 * confidence level (in percent).
 *
 * @since 1.0.0
 */
public final class PredictionInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final int level;
    private final double lower;
    private final double upper;

    public PredictionInterval(Instant timestamp, int level, double lower, double upper) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.level = level;
        this.lower = lower;
        this.upper = upper;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getLevel() {
        return level;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PredictionInterval that))
            return false;
        return level == that.level
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, lower, upper);
    }

    @Override
    public String toString() {
        return "PredictionInterval{" + timestamp + " " + level + "%=[" + lower + ", " + upper + "]}";
    }
}
