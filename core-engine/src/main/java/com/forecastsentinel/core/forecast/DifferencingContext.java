package com.forecastsentinel.core.forecast;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Regular and seasonal differencing, with enough history retained to undo
 * it on forecasts.
 *
 * <p>
 * {@link #apply} runs the seasonal stages (lag {@code m}) first and the
 * regular stages (lag 1) after. For every stage the tail of the series
 * <em>before</em> that stage is kept; {@link #integrate(double[])} walks the
 * stages backwards and rebuilds each level from those tails.
 * </p>
 */
public final class DifferencingContext implements Serializable {

    private static final long serialVersionUID = 1L;

    /** One differencing stage: its lag and the last {@code lag} inputs. */
    private static final class Stage implements Serializable {
        private static final long serialVersionUID = 1L;

        final int lag;
        final double[] tail;

        Stage(int lag, double[] tail) {
            this.lag = lag;
            this.tail = tail;
        }
    }

    private final List<Stage> stages;

    private DifferencingContext(List<Stage> stages) {
        this.stages = Collections.unmodifiableList(stages);
    }

    /**
     * Result of {@link #apply}: the differenced series and the context that
     * inverts it.
     */
    public static final class Differenced {
        private final double[] values;
        private final DifferencingContext context;

        private Differenced(double[] values, DifferencingContext context) {
            this.values = values;
            this.context = context;
        }

        public double[] getValues() {
            return values.clone();
        }

        public DifferencingContext getContext() {
            return context;
        }
    }

    /**
     * Difference {@code y} {@code d} times at lag 1 and {@code seasonalD}
     * times at lag {@code period}.
     *
     * @return the differenced series, {@code d + seasonalD * period} points
     *         shorter than the input
     * @throws IllegalArgumentException if an order is negative or the series
     *                                  is too short
     */
    public static Differenced apply(double[] y, int d, int seasonalD, int period) {
        if (d < 0 || seasonalD < 0) {
            throw new IllegalArgumentException(
                    "Differencing orders must be >= 0, got d=" + d + ", D=" + seasonalD);
        }
        if (seasonalD > 0 && period < 2) {
            throw new IllegalArgumentException("Seasonal differencing requires a period >= 2, got: " + period);
        }

        List<Stage> stages = new ArrayList<>(d + seasonalD);
        double[] current = y.clone();
        for (int i = 0; i < seasonalD; i++) {
            current = difference(current, period, stages);
        }
        for (int i = 0; i < d; i++) {
            current = difference(current, 1, stages);
        }
        return new Differenced(current, new DifferencingContext(stages));
    }

    private static double[] difference(double[] series, int lag, List<Stage> stages) {
        if (series.length <= lag) {
            throw new IllegalArgumentException(
                    "Cannot difference " + series.length + " points at lag " + lag);
        }
        stages.add(new Stage(lag, Arrays.copyOfRange(series, series.length - lag, series.length)));
        double[] out = new double[series.length - lag];
        for (int t = lag; t < series.length; t++) {
            out[t - lag] = series[t] - series[t - lag];
        }
        return out;
    }

    /**
     * Undo every differencing stage on values that continue the differenced
     * series.
     *
     * @param forecast values on the differenced scale
     * @return the same horizon on the original scale
     * @throws ArithmeticException if the result is not finite
     */
    public double[] integrate(double[] forecast) {
        double[] current = forecast.clone();
        for (int s = stages.size() - 1; s >= 0; s--) {
            Stage stage = stages.get(s);
            double[] history = new double[stage.lag + current.length];
            System.arraycopy(stage.tail, 0, history, 0, stage.lag);
            for (int h = 0; h < current.length; h++) {
                history[stage.lag + h] = current[h] + history[h];
            }
            current = Arrays.copyOfRange(history, stage.lag, history.length);
        }
        for (int h = 0; h < current.length; h++) {
            if (!Double.isFinite(current[h])) {
                throw new ArithmeticException("Integrated forecast overflowed at step " + (h + 1));
            }
        }
        return current;
    }

    /**
     * @return the lag of every stage in application order
     */
    public int[] lags() {
        return stages.stream().mapToInt(stage -> stage.lag).toArray();
    }

    public boolean isIdentity() {
        return stages.isEmpty();
    }
}
