package com.forecastsentinel.core.forecast;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fitted ARIMA coefficients together with the recent history the forecast
 * recursion starts from.
 *
 * <p>
 * {@code zTail} holds the last values of the differenced, mean-adjusted
 * series (as many as the largest AR lag) and {@code eTail} the last in-sample
 * residuals (as many as the largest MA lag). Both are left-padded with zeros
 * when the training series was shorter.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArimaState implements ModelState {

    private static final long serialVersionUID = 1L;

    private final int p;
    private final int d;
    private final int q;
    private final int seasonalP;
    private final int seasonalD;
    private final int seasonalQ;
    private final int period;
    private final int[] arLags;
    private final int[] maLags;
    private final double[] phi;
    private final double[] theta;
    private final double mean;
    private final double residualVariance;
    private final double[] fittedValues;
    private final double[] zTail;
    private final double[] eTail;
    private final DifferencingContext differencing;
    private final int trainingSize;
    private final Instant lastTimestamp;
    private final Duration step;

    ArimaState(int[] order, int[] seasonalOrder, int period,
               int[] arLags, int[] maLags, double[] phi, double[] theta,
               double mean, double residualVariance, double[] fittedValues,
               double[] zTail, double[] eTail, DifferencingContext differencing,
               int trainingSize, Instant lastTimestamp, Duration step) {
        this.p = order[0];
        this.d = order[1];
        this.q = order[2];
        this.seasonalP = seasonalOrder[0];
        this.seasonalD = seasonalOrder[1];
        this.seasonalQ = seasonalOrder[2];
        this.period = period;
        this.arLags = arLags.clone();
        this.maLags = maLags.clone();
        this.phi = phi.clone();
        this.theta = theta.clone();
        this.mean = mean;
        this.residualVariance = residualVariance;
        this.fittedValues = fittedValues.clone();
        this.zTail = zTail.clone();
        this.eTail = eTail.clone();
        this.differencing = Objects.requireNonNull(differencing);
        this.trainingSize = trainingSize;
        this.lastTimestamp = Objects.requireNonNull(lastTimestamp);
        this.step = Objects.requireNonNull(step);
    }

    public int[] getArLags() {
        return arLags.clone();
    }

    public int[] getMaLags() {
        return maLags.clone();
    }

    /**
     * @return AR coefficients aligned with {@link #getArLags()}
     */
    public double[] getPhi() {
        return phi.clone();
    }

    /**
     * @return MA coefficients aligned with {@link #getMaLags()}
     */
    public double[] getTheta() {
        return theta.clone();
    }

    /**
     * @return the mean of the training series, 0 when any differencing was
     *         applied
     */
    public double getMean() {
        return mean;
    }

    public int getPeriod() {
        return period;
    }

    /**
     * @return one-step-ahead in-sample predictions on the original scale,
     *         starting after the points consumed by differencing and the
     *         largest AR lag
     */
    @Override
    public double[] getFittedValues() {
        return fittedValues.clone();
    }

    double[] zTail() {
        return zTail.clone();
    }

    double[] eTail() {
        return eTail.clone();
    }

    DifferencingContext differencing() {
        return differencing;
    }

    @Override
    public double getResidualVariance() {
        return residualVariance;
    }

    @Override
    public int getTrainingSize() {
        return trainingSize;
    }

    @Override
    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    @Override
    public Duration getStep() {
        return step;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("order", Arrays.asList(p, d, q));
        params.put("seasonalOrder", Arrays.asList(seasonalP, seasonalD, seasonalQ));
        params.put("period", period);
        params.put("phi", Arrays.stream(phi).boxed().toList());
        params.put("theta", Arrays.stream(theta).boxed().toList());
        params.put("mean", mean);
        params.put("sigma2", residualVariance);
        return Collections.unmodifiableMap(params);
    }

    @Override
    public String toString() {
        return "ArimaState{" +
                "order=(" + p + "," + d + "," + q + ")" +
                ", seasonalOrder=(" + seasonalP + "," + seasonalD + "," + seasonalQ + ")" +
                ", period=" + period +
                ", phi=" + Arrays.toString(phi) +
                ", theta=" + Arrays.toString(theta) +
                ", mean=" + mean +
                ", sigma2=" + residualVariance +
                '}';
    }
}
