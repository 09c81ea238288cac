package com.forecastsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Predicted values, one per horizon step, contiguous and starting one
 * sampling interval after the last timestamp of the series the model was fit
 * on.
 *
 * <p>
 * Prediction intervals are optional; they are only populated when the caller
 * asked for confidence levels.
 * </p>
 *
 * @since 1.0.0
 */
public final class Forecast implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<DataPoint> points;
    private final List<PredictionInterval> intervals;

    public Forecast(List<DataPoint> points) {
        this(points, List.of());
    }

    /**
     * @param points    predicted values; none may be a gap
     * @param intervals prediction intervals, possibly empty
     * @throws IllegalArgumentException if a predicted point has no value
     */
    public Forecast(List<DataPoint> points, List<PredictionInterval> intervals) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(intervals, "intervals must not be null");
        for (DataPoint point : points) {
            if (point.isGap()) {
                throw new IllegalArgumentException("Forecast point at " + point.getTimestamp() + " has no value");
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
    }

    public List<DataPoint> getPoints() {
        return points;
    }

    public List<PredictionInterval> getIntervals() {
        return intervals;
    }

    /**
     * @param level confidence level in percent
     * @return the intervals for that level, in chronological order
     */
    public List<PredictionInterval> intervalsAt(int level) {
        return intervals.stream()
                .filter(interval -> interval.getLevel() == level)
                .toList();
    }

    public int size() {
        return points.size();
    }

    public double valueAt(int index) {
        return points.get(index).getValue();
    }

    /**
     * @return the first {@code count} predicted points (and their intervals)
     */
    public Forecast head(int count) {
        if (count >= points.size()) {
            return this;
        }
        List<DataPoint> kept = points.subList(0, count);
        Instant cutoff = kept.isEmpty() ? null : kept.get(kept.size() - 1).getTimestamp();
        List<PredictionInterval> keptIntervals = cutoff == null
                ? List.of()
                : intervals.stream().filter(i -> !i.getTimestamp().isAfter(cutoff)).toList();
        return new Forecast(kept, keptIntervals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Forecast that))
            return false;
        return points.equals(that.points) && intervals.equals(that.intervals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, intervals);
    }

    @Override
    public String toString() {
        return "Forecast{points=" + points.size() + ", intervals=" + intervals.size() + '}';
    }
}
