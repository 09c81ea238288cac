package com.forecastsentinel.core.preprocessing;

import java.time.Duration;
import java.util.Objects;

/**
 * Converts a seasonal cycle expressed as a duration into a sample count.
 *
 * @since 1.0.0
 */
public final class SeasonalPeriod {

    /** Smallest usable number of samples per seasonal cycle. */
    public static final int MIN_SAMPLES = 2;

    private SeasonalPeriod() {
        // utility class, not instantiable
    }

    /**
     * @param period length of one seasonal cycle
     * @param step   sampling interval of the series
     * @return the number of samples per cycle
     * @throws IllegalArgumentException if the period is not a whole multiple of
     *                                  the step or covers fewer than
     *                                  {@value #MIN_SAMPLES} samples
     */
    public static int samples(Duration period, Duration step) {
        Objects.requireNonNull(period, "period must not be null");
        Objects.requireNonNull(step, "step must not be null");
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }

        long periodNanos = period.toNanos();
        long stepNanos = step.toNanos();
        if (periodNanos % stepNanos != 0) {
            throw new IllegalArgumentException(
                    "Seasonal period " + period + " is not a multiple of the step " + step);
        }
        long samples = periodNanos / stepNanos;
        if (samples < MIN_SAMPLES) {
            throw new IllegalArgumentException(
                    "Seasonal period " + period + " is too short for step " + step
                            + ": " + samples + " sample(s), need at least " + MIN_SAMPLES);
        }
        return Math.toIntExact(samples);
    }
}
