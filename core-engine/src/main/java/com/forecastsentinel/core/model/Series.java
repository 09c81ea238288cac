package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, regularly sampled time series.
 *
 * <p>
 * Timestamps are strictly increasing and nominally {@link #getStep()} apart.
 * Values may be missing ({@link DataPoint#isGap()}) until the series has been
 * through the {@link com.forecastsentinel.core.preprocessing.Preprocessor}.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * A series is never mutated after construction. Operations such as gap filling
 * or splitting return new instances, so models can safely hold a reference to
 * the training data they were given.
 * </p>
 *
 * @since 1.0.0
 */
public final class Series implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Duration step;
    private final List<DataPoint> points;

    /**
     * @param step   nominal sampling interval; must be positive
     * @param points observations in chronological order
     * @throws NullPointerException     if any argument or point is {@code null}
     * @throws IllegalArgumentException if the step is not positive, the
     *                                  timestamps are not strictly increasing
     *                                  or a timestamp is off the grid
     *                                  {@code t0 + i * step}
     */
    public Series(Duration step, List<DataPoint> points) {
        this.step = Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(points, "points must not be null");
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }

        List<DataPoint> copy = new ArrayList<>(points.size());
        Instant previous = null;
        for (DataPoint point : points) {
            Objects.requireNonNull(point, "points must not contain null");
            if (previous != null && !point.getTimestamp().isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Timestamps must be strictly increasing: " + point.getTimestamp()
                                + " does not follow " + previous);
            }
            if (!copy.isEmpty()) {
                Instant expected = copy.get(0).getTimestamp().plus(step.multipliedBy(copy.size()));
                if (!point.getTimestamp().equals(expected)) {
                    throw new IllegalArgumentException(
                            "Timestamp " + point.getTimestamp() + " is off the " + step
                                    + " grid; expected " + expected + " (mark missing samples as gaps)");
                }
            }
            previous = point.getTimestamp();
            copy.add(point);
        }
        this.points = Collections.unmodifiableList(copy);
    }

    /**
     * Build a gap-free series of evenly spaced values.
     *
     * @param start  timestamp of the first value
     * @param step   sampling interval
     * @param values observed values
     * @return new series
     */
    public static Series of(Instant start, Duration step, double... values) {
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(DataPoint.of(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new Series(step, points);
    }

    /**
     * Build an evenly spaced series where {@code null} entries are gaps.
     *
     * @param start  timestamp of the first value
     * @param step   sampling interval
     * @param values observed values, {@code null} for missing samples
     * @return new series
     */
    public static Series withGaps(Instant start, Duration step, Double... values) {
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new Series(step, points);
    }

    public Duration getStep() {
        return step;
    }

    /**
     * @return unmodifiable view of the points
     */
    public List<DataPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public DataPoint get(int index) {
        return points.get(index);
    }

    public Instant timestampAt(int index) {
        return points.get(index).getTimestamp();
    }

    /**
     * @return the last timestamp
     * @throws IllegalStateException if the series is empty
     */
    public Instant lastTimestamp() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return points.get(points.size() - 1).getTimestamp();
    }

    /**
     * Timestamp {@code stepsAhead} sampling intervals after the last point.
     *
     * @param stepsAhead number of steps past the end (1 = next sample)
     * @return the projected timestamp
     */
    public Instant timestampAfterEnd(int stepsAhead) {
        return lastTimestamp().plus(step.multipliedBy(stepsAhead));
    }

    /**
     * @return {@code true} when no point is a gap
     */
    public boolean isComplete() {
        for (DataPoint point : points) {
            if (point.isGap()) {
                return false;
            }
        }
        return true;
    }

    public int knownCount() {
        int count = 0;
        for (DataPoint point : points) {
            if (!point.isGap()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Copy the values into a primitive array.
     *
     * @return the values in chronological order
     * @throws IllegalStateException if the series still contains gaps
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = points.get(i).getValue();
            if (value == null) {
                throw new IllegalStateException(
                        "Series has a gap at " + points.get(i).getTimestamp() + "; fill it first");
            }
            values[i] = value;
        }
        return values;
    }

    /**
     * Return the sub-series {@code [fromIndex, toIndex)}.
     *
     * @param fromIndex first index, inclusive
     * @param toIndex   last index, exclusive
     * @return new series sharing this series' step
     */
    public Series slice(int fromIndex, int toIndex) {
        return new Series(step, points.subList(fromIndex, toIndex));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Series that))
            return false;
        return step.equals(that.step) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, points);
    }

    @Override
    public String toString() {
        if (points.isEmpty()) {
            return "Series{step=" + step + ", empty}";
        }
        return "Series{step=" + step
                + ", size=" + points.size()
                + ", from=" + points.get(0).getTimestamp()
                + ", to=" + lastTimestamp() + '}';
    }
}
