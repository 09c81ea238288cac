package com.forecastsentinel.core.preprocessing;

import com.forecastsentinel.core.model.Series;

import java.util.Objects;

/**
 * Splits a series into training and evaluation segments by percentage.
 *
 * <p>
 * The split is chronological: the first {@code floor(size * trainPercent / 100)}
 * points train the model, the rest are held out. Points are never shuffled.
 * </p>
 *
 * @since 1.0.0
 */
public final class Splitter {

    private Splitter() {
        // utility class, not instantiable
    }

    /**
     * @param series       the series to split; must not be {@code null}
     * @param trainPercent share of points used for training, in {@code (0, 100]}
     * @return the two segments; the test segment is empty at 100 %
     * @throws IllegalArgumentException if {@code trainPercent} is out of range
     */
    public static SplitSeries split(Series series, double trainPercent) {
        Objects.requireNonNull(series, "Series must not be null");
        if (!(trainPercent > 0 && trainPercent <= 100)) {
            throw new IllegalArgumentException("trainPercent must be in (0, 100], got: " + trainPercent);
        }

        int trainSize = (int) Math.floor(series.size() * trainPercent / 100.0);
        return new SplitSeries(series.slice(0, trainSize), series.slice(trainSize, series.size()));
    }
}
