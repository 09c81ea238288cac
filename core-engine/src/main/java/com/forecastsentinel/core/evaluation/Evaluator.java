package com.forecastsentinel.core.evaluation;

import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.Residual;
import com.forecastsentinel.core.model.Series;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accuracy measures between a forecast and the actual values it predicted.
 *
 * <p>
 * Both sides must have the same length and identical timestamps, point for
 * point; any mismatch, including two empty inputs, raises an
 * {@link AlignmentException}. Gaps in the actual series are rejected the
 * same way.
 * </p>
 *
 * @since 1.0.0
 */
public final class Evaluator {

    private Evaluator() {
        // utility class, not instantiable
    }

    /**
     * Root mean squared error, {@code sqrt(mean((f - a)^2))}.
     *
     * @throws AlignmentException if the inputs are empty or not aligned
     */
    public static double rmse(Forecast forecast, Series actual) {
        return rmse(forecast.getPoints(), actual.getPoints());
    }

    /**
     * Root mean squared error over two aligned point lists. Symmetric in its
     * arguments.
     *
     * @throws AlignmentException if the inputs are empty or not aligned
     */
    public static double rmse(List<DataPoint> predicted, List<DataPoint> actual) {
        double sum = 0;
        for (double error : errors(predicted, actual)) {
            sum += error * error;
        }
        return Math.sqrt(sum / actual.size());
    }

    /**
     * Mean absolute error, {@code mean(|f - a|)}.
     *
     * @throws AlignmentException if the inputs are empty or not aligned
     */
    public static double mae(Forecast forecast, Series actual) {
        double sum = 0;
        for (double error : errors(forecast.getPoints(), actual.getPoints())) {
            sum += Math.abs(error);
        }
        return sum / actual.size();
    }

    /**
     * @return one residual per point, {@code actual - predicted}
     * @throws AlignmentException if the inputs are empty or not aligned
     */
    public static List<Residual> residuals(Series actual, Forecast forecast) {
        List<DataPoint> predicted = forecast.getPoints();
        List<DataPoint> observed = actual.getPoints();
        checkAlignment(predicted, observed);

        List<Residual> residuals = new ArrayList<>(observed.size());
        for (int i = 0; i < observed.size(); i++) {
            residuals.add(new Residual(observed.get(i).getTimestamp(),
                    observed.get(i).getValue(), predicted.get(i).getValue()));
        }
        return residuals;
    }

    private static double[] errors(List<DataPoint> predicted, List<DataPoint> actual) {
        checkAlignment(predicted, actual);
        double[] errors = new double[actual.size()];
        for (int i = 0; i < actual.size(); i++) {
            errors[i] = predicted.get(i).getValue() - actual.get(i).getValue();
        }
        return errors;
    }

    private static void checkAlignment(List<DataPoint> predicted, List<DataPoint> actual) {
        Objects.requireNonNull(predicted, "predicted must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
        if (predicted.isEmpty() || actual.isEmpty()) {
            throw new AlignmentException("Cannot evaluate an empty series");
        }
        if (predicted.size() != actual.size()) {
            throw new AlignmentException("Length mismatch: " + predicted.size()
                    + " predicted vs " + actual.size() + " actual points");
        }
        for (int i = 0; i < actual.size(); i++) {
            DataPoint p = predicted.get(i);
            DataPoint a = actual.get(i);
            if (!p.getTimestamp().equals(a.getTimestamp())) {
                throw new AlignmentException("Timestamp mismatch at index " + i + ": "
                        + p.getTimestamp() + " vs " + a.getTimestamp());
            }
            if (p.isGap() || a.isGap()) {
                throw new AlignmentException("Missing value at " + a.getTimestamp());
            }
        }
    }
}
