package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.config.ModelSettings;
import com.forecastsentinel.core.error.InsufficientDataException;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.Series;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Autoregressive integrated moving average model with optional seasonal
 * terms.
 *
 * <p>
 * The series is differenced {@code D} times at the seasonal lag and
 * {@code d} times at lag 1. The remaining series is modeled as an ARMA
 * process over the lags {1..p} and {m, 2m, .., Pm} (AR) and {1..q} and
 * {m, 2m, .., Qm} (MA); seasonal terms enter additively as extra lags.
 * Without differencing the series mean is removed before estimation and
 * added back to the forecast.
 * </p>
 *
 * <p>
 * Forecasts use the fitted recursion with all future errors set to zero,
 * then undo the differencing. Prediction intervals come from the
 * psi-weights of the integrated process.
 * </p>
 *
 * @see ArimaEstimator
 * @since 1.0.0
 */
public class ArimaModel implements ForecastModel {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaModel.class);

    public static final String NAME = ModelSettings.ARIMA;

    private final int p;
    private final int d;
    private final int q;
    private final int seasonalP;
    private final int seasonalD;
    private final int seasonalQ;
    private final int period;
    private final int maxIterations;
    private final int[] arLags;
    private final int[] maLags;

    private ArimaState state;

    /**
     * @param settings       model configuration
     * @param seasonalPeriod samples per seasonal cycle, ignored without
     *                       seasonal orders
     * @throws IllegalArgumentException if an order is negative or seasonal
     *                                  orders come without a period >= 2
     */
    public ArimaModel(ModelSettings settings, int seasonalPeriod) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        this.p = settings.getP();
        this.d = settings.getD();
        this.q = settings.getQ();
        this.seasonalP = settings.getSeasonalP();
        this.seasonalD = settings.getSeasonalD();
        this.seasonalQ = settings.getSeasonalQ();
        this.maxIterations = settings.getMaxIterations();

        if (p < 0 || d < 0 || q < 0 || seasonalP < 0 || seasonalD < 0 || seasonalQ < 0) {
            throw new IllegalArgumentException("ARIMA orders must be >= 0: " + describeOrder());
        }
        boolean seasonal = seasonalP > 0 || seasonalD > 0 || seasonalQ > 0;
        if (seasonal && seasonalPeriod < 2) {
            throw new IllegalArgumentException(
                    "Seasonal ARIMA requires a seasonal period >= 2, got: " + seasonalPeriod);
        }
        this.period = seasonal ? seasonalPeriod : 0;
        this.arLags = lags(p, seasonalP, period);
        this.maLags = lags(q, seasonalQ, period);
    }

    @Override
    public ModelState fit(Series train) {
        Objects.requireNonNull(train, "Training series must not be null");

        int minimum = p + q + d + seasonalP + seasonalQ + seasonalD * period;
        if (train.size() <= minimum) {
            throw new InsufficientDataException(
                    "ARIMA" + describeOrder() + " needs more training points",
                    minimum + 1, train.size());
        }

        double[] y = train.values();
        DifferencingContext.Differenced differenced = DifferencingContext.apply(y, d, seasonalD, period);
        double[] z = differenced.getValues();
        double mean = d == 0 && seasonalD == 0 ? StatUtils.mean(z) : 0.0;
        for (int t = 0; t < z.length; t++) {
            z[t] -= mean;
        }

        ArimaEstimator.Estimate estimate = ArimaEstimator.estimate(z, arLags, maLags, maxIterations);

        // One-step errors are the same on the differenced and original scale
        int consumed = y.length - z.length;
        int first = consumed + maxLag(arLags);
        double[] fitted = new double[y.length - first];
        for (int t = first; t < y.length; t++) {
            fitted[t - first] = y[t] - estimate.residuals[t - consumed];
        }

        state = new ArimaState(
                new int[] {p, d, q}, new int[] {seasonalP, seasonalD, seasonalQ}, period,
                arLags, maLags, estimate.phi, estimate.theta, mean, estimate.sigma2, fitted,
                tail(z, maxLag(arLags)), tail(estimate.residuals, maxLag(maLags)),
                differenced.getContext(), y.length, train.lastTimestamp(), train.getStep());
        LOG.info("Fitted ARIMA{} on {} points: phi={} theta={} sigma2={}",
                describeOrder(), y.length, Arrays.toString(estimate.phi),
                Arrays.toString(estimate.theta), estimate.sigma2);
        return state;
    }

    @Override
    public Forecast forecast(int horizon, List<Integer> confidenceLevels) {
        Forecasts.requireHorizon(horizon);
        ArimaState fitted = requireState();

        double[] phi = fitted.getPhi();
        double[] theta = fitted.getTheta();
        double[] zTail = fitted.zTail();
        double[] eTail = fitted.eTail();
        int zOffset = zTail.length;
        int eOffset = eTail.length;

        double[] z = Arrays.copyOf(zTail, zOffset + horizon);
        // Future innovations are zero
        double[] e = Arrays.copyOf(eTail, eOffset + horizon);

        double[] differenced = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double value = 0;
            for (int i = 0; i < arLags.length; i++) {
                value += phi[i] * z[zOffset + h - arLags[i]];
            }
            for (int j = 0; j < maLags.length; j++) {
                value += theta[j] * e[eOffset + h - maLags[j]];
            }
            z[zOffset + h] = value;
            differenced[h] = value + fitted.getMean();
        }

        DifferencingContext context = fitted.differencing();
        double[] values = context.isIdentity() ? differenced : context.integrate(differenced);
        double[] psi = psiWeights(phi, theta, context.lags(), horizon);
        double[] errors = new double[horizon];
        double accumulated = 0;
        for (int h = 0; h < horizon; h++) {
            accumulated += psi[h] * psi[h];
            errors[h] = Math.sqrt(fitted.getResidualVariance() * accumulated);
        }
        return Forecasts.assemble(fitted, values, errors, confidenceLevels);
    }

    @Override
    public Optional<ModelState> getState() {
        return Optional.ofNullable(state);
    }

    @Override
    public String getModelName() {
        return NAME;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Psi-weights of the integrated process: the AR polynomial multiplied by
     * (1 - B^lag) for every differencing stage, divided into the MA
     * polynomial.
     */
    private double[] psiWeights(double[] phi, double[] theta, int[] differencingLags, int count) {
        int degree = maxLag(arLags) + Arrays.stream(differencingLags).sum();
        double[] ar = new double[degree + 1];
        ar[0] = 1.0;
        for (int i = 0; i < arLags.length; i++) {
            ar[arLags[i]] -= phi[i];
        }
        for (int lag : differencingLags) {
            double[] product = ar.clone();
            for (int k = lag; k <= degree; k++) {
                product[k] -= ar[k - lag];
            }
            ar = product;
        }

        double[] ma = new double[count];
        for (int j = 0; j < maLags.length; j++) {
            if (maLags[j] < count) {
                ma[maLags[j]] += theta[j];
            }
        }

        double[] psi = new double[count];
        psi[0] = 1.0;
        for (int j = 1; j < count; j++) {
            double value = ma[j];
            for (int k = 1; k <= Math.min(j, degree); k++) {
                value -= ar[k] * psi[j - k];
            }
            psi[j] = value;
        }
        return psi;
    }

    static int[] lags(int order, int seasonalOrder, int period) {
        TreeSet<Integer> lags = new TreeSet<>();
        for (int i = 1; i <= order; i++) {
            lags.add(i);
        }
        for (int i = 1; i <= seasonalOrder; i++) {
            lags.add(i * period);
        }
        return lags.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int maxLag(int[] lags) {
        return lags.length == 0 ? 0 : lags[lags.length - 1];
    }

    private static double[] tail(double[] values, int length) {
        double[] tail = new double[length];
        int available = Math.min(length, values.length);
        System.arraycopy(values, values.length - available, tail, length - available, available);
        return tail;
    }

    private String describeOrder() {
        String order = "(" + p + "," + d + "," + q + ")";
        return period > 0 ? order + "(" + seasonalP + "," + seasonalD + "," + seasonalQ + ")" + period : order;
    }

    private ArimaState requireState() {
        if (state == null) {
            throw new IllegalStateException("ARIMA model has not been fit");
        }
        return state;
    }
}
