package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.PredictionInterval;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles {@link Forecast} instances from raw model output.
 */
final class Forecasts {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0, 1);

    private Forecasts() {
        // utility class, not instantiable
    }

    /**
     * @param state          fitted state supplying the time axis
     * @param values         predicted values, one per step
     * @param standardErrors forecast standard error per step
     * @param levels         confidence levels in percent
     * @return the assembled forecast
     * @throws ArithmeticException if a predicted value is not finite
     */
    static Forecast assemble(ModelState state, double[] values, double[] standardErrors, List<Integer> levels) {
        List<DataPoint> points = new ArrayList<>(values.length);
        List<PredictionInterval> intervals = new ArrayList<>(values.length * levels.size());

        for (int h = 0; h < values.length; h++) {
            if (!Double.isFinite(values[h])) {
                throw new ArithmeticException("Forecast overflowed at step " + (h + 1) + ": " + values[h]);
            }
            Instant timestamp = state.getLastTimestamp().plus(state.getStep().multipliedBy(h + 1L));
            points.add(DataPoint.of(timestamp, values[h]));
            for (Integer level : levels) {
                double margin = quantile(level) * standardErrors[h];
                intervals.add(new PredictionInterval(timestamp, level, values[h] - margin, values[h] + margin));
            }
        }
        return new Forecast(points, intervals);
    }

    static void requireHorizon(int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got: " + horizon);
        }
    }

    private static double quantile(int level) {
        if (level <= 0 || level >= 100) {
            throw new IllegalArgumentException("Confidence level must be in (0, 100), got: " + level);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200.0);
    }
}
