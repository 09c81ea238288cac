package com.forecastsentinel.core.preprocessing;

import com.forecastsentinel.core.error.InsufficientDataException;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fills the gaps of a regularly sampled series.
 *
 * <p>
 * Interior gaps are linearly interpolated in time between the nearest known
 * values on either side. Leading and trailing gaps have a known value on one
 * side only and take that value (constant extension).
 * </p>
 *
 * @since 1.0.0
 */
public final class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    /** Minimum number of known values required to interpolate. */
    static final int MIN_KNOWN_POINTS = 2;

    private Preprocessor() {
        // utility class, not instantiable
    }

    /**
     * Return a copy of {@code series} with every gap filled.
     *
     * @param series the raw series; must not be {@code null}
     * @return a gap-free series, or {@code series} itself if it had no gaps
     * @throws InsufficientDataException if fewer than two values are known
     */
    public static Series fill(Series series) {
        Objects.requireNonNull(series, "Series must not be null");

        int known = series.knownCount();
        if (known < MIN_KNOWN_POINTS) {
            throw new InsufficientDataException(
                    "Cannot interpolate a series with fewer than " + MIN_KNOWN_POINTS + " known values",
                    MIN_KNOWN_POINTS, known);
        }
        if (known == series.size()) {
            return series;
        }

        List<DataPoint> in = series.getPoints();
        List<DataPoint> out = new ArrayList<>(in.size());
        int previousKnown = -1;
        int nextKnown = nextKnownIndex(in, 0);

        for (int i = 0; i < in.size(); i++) {
            DataPoint point = in.get(i);
            if (!point.isGap()) {
                out.add(point);
                previousKnown = i;
                nextKnown = nextKnownIndex(in, i + 1);
                continue;
            }
            if (previousKnown < 0) {
                out.add(point.withValue(in.get(nextKnown).getValue()));
            } else if (nextKnown < 0) {
                out.add(point.withValue(in.get(previousKnown).getValue()));
            } else {
                out.add(point.withValue(interpolate(in.get(previousKnown), in.get(nextKnown), point)));
            }
        }

        LOG.debug("Filled {} gap(s) in {}", series.size() - known, series);
        return new Series(series.getStep(), out);
    }

    private static double interpolate(DataPoint before, DataPoint after, DataPoint gap) {
        long t0 = before.getTimestamp().toEpochMilli();
        long t1 = after.getTimestamp().toEpochMilli();
        long t = gap.getTimestamp().toEpochMilli();
        double a = before.getValue();
        double b = after.getValue();
        return a + (b - a) * (t - t0) / (double) (t1 - t0);
    }

    private static int nextKnownIndex(List<DataPoint> points, int from) {
        for (int i = from; i < points.size(); i++) {
            if (!points.get(i).isGap()) {
                return i;
            }
        }
        return -1;
    }
}
