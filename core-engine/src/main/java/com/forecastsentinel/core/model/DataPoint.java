package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single timestamped observation.
 *
 * <p>
 * A {@code null} value marks a gap (missing sample). Gaps only exist in raw
 * input; every series handed to a model has been filled.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final Double value;

    /**
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value, or {@code null} for a gap
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    @JsonCreator
    public DataPoint(@JsonProperty("timestamp") Instant timestamp,
                     @JsonProperty("value") Double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public static DataPoint of(Instant timestamp, double value) {
        return new DataPoint(timestamp, value);
    }

    public static DataPoint gap(Instant timestamp) {
        return new DataPoint(timestamp, null);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return the value, or {@code null} if this point is a gap
     */
    public Double getValue() {
        return value;
    }

    @JsonIgnore
    public boolean isGap() {
        return value == null;
    }

    /**
     * Return a copy of this point carrying a new value.
     *
     * @param newValue the replacement value
     * @return new data point at the same timestamp
     */
    public DataPoint withValue(double newValue) {
        return new DataPoint(timestamp, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return timestamp.equals(that.timestamp) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "DataPoint{" + timestamp + "=" + value + '}';
    }
}
