package com.forecastsentinel.core.preprocessing;

import com.forecastsentinel.core.model.Series;

import java.util.Objects;

/**
 * Chronological partition of a series into a training prefix and an
 * evaluation suffix.
 *
 * @since 1.0.0
 */
public final class SplitSeries {

    private final Series train;
    private final Series test;

    public SplitSeries(Series train, Series test) {
        this.train = Objects.requireNonNull(train, "train must not be null");
        this.test = Objects.requireNonNull(test, "test must not be null");
    }

    public Series getTrain() {
        return train;
    }

    /**
     * @return the evaluation segment; empty when the split kept every point
     *         for training
     */
    public Series getTest() {
        return test;
    }

    public boolean hasTest() {
        return !test.isEmpty();
    }

    @Override
    public String toString() {
        return "SplitSeries{train=" + train.size() + ", test=" + test.size() + '}';
    }
}
