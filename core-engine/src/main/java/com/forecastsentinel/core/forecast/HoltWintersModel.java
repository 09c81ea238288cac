package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.config.ModelSettings;
import com.forecastsentinel.core.error.InsufficientDataException;
import com.forecastsentinel.core.error.NonConvergenceException;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.Series;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Holt-Winters triple exponential smoothing.
 *
 * <p>
 * Level, trend and seasonal components are smoothed with the constants
 * α, β and γ. Trend and season are each {@link ComponentType#NONE none},
 * additive or multiplicative. Constants that are not configured are chosen
 * by minimizing the in-sample sum of squared one-step errors: a coarse grid
 * provides the starting point, then BOBYQA (two or more free constants) or
 * Brent (one) refines it within the bounds
 * [{@value #MIN_SMOOTHING}, {@value #MAX_SMOOTHING}].
 * </p>
 *
 * <h3>Initialization</h3>
 * <p>
 * An ordinary least squares line is fit over the first cycle (the first two
 * points without seasonality). Its value at the end of the cycle seeds the
 * level, its slope the trend, and the deviations of the first cycle from the
 * line seed the seasonal indices.
 * </p>
 *
 * <h3>Multiplicative components</h3>
 * <p>
 * A multiplicative trend or season is only defined for strictly positive
 * data: {@link #fit(Series)} rejects any zero or negative training value with
 * an {@link IllegalArgumentException} instead of clamping it.
 * </p>
 *
 * @since 1.0.0
 */
public class HoltWintersModel implements ForecastModel {

    private static final Logger LOG = LoggerFactory.getLogger(HoltWintersModel.class);

    public static final String NAME = ModelSettings.HOLT_WINTERS;

    static final double MIN_SMOOTHING = 1e-4;
    static final double MAX_SMOOTHING = 1 - 1e-4;

    /** Starting values tried for every free smoothing constant. */
    private static final double[] GRID = {0.1, 0.3, 0.5, 0.7, 0.9};

    private static final int ALPHA = 0;
    private static final int BETA = 1;
    private static final int GAMMA = 2;

    private final ComponentType trendType;
    private final ComponentType seasonalType;
    private final int period;
    private final Double fixedAlpha;
    private final Double fixedBeta;
    private final Double fixedGamma;
    private final int maxEvaluations;

    private HoltWintersState state;

    /**
     * @param settings       model configuration
     * @param seasonalPeriod samples per seasonal cycle, ignored without
     *                       seasonality
     * @throws NullPointerException     if {@code settings} is {@code null}
     * @throws IllegalArgumentException if seasonality is enabled with a period
     *                                  below 2 or a component type is unknown
     */
    public HoltWintersModel(ModelSettings settings, int seasonalPeriod) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        this.trendType = ComponentType.fromString(settings.getTrend());
        this.seasonalType = ComponentType.fromString(settings.getSeasonal());
        this.fixedAlpha = settings.getAlpha();
        this.fixedBeta = settings.getBeta();
        this.fixedGamma = settings.getGamma();
        this.maxEvaluations = settings.getMaxIterations() * 4;

        if (seasonalType != ComponentType.NONE && seasonalPeriod < 2) {
            throw new IllegalArgumentException(
                    "Seasonal Holt-Winters requires a seasonal period >= 2, got: " + seasonalPeriod);
        }
        this.period = seasonalType != ComponentType.NONE ? seasonalPeriod : 0;
    }

    @Override
    public ModelState fit(Series train) {
        Objects.requireNonNull(train, "Training series must not be null");

        int window = initWindow();
        if (train.size() < 2 * window) {
            throw new InsufficientDataException(
                    "Holt-Winters needs at least two full seasonal periods of training data",
                    2 * window, train.size());
        }
        if (trendType == ComponentType.MULTIPLICATIVE || seasonalType == ComponentType.MULTIPLICATIVE) {
            requirePositive(train);
        }

        double[] y = train.values();
        double[] params = resolveParameters(y);
        Smoothing result = smooth(y, params[ALPHA], params[BETA], params[GAMMA]);
        if (!Double.isFinite(result.sse)) {
            throw new NonConvergenceException(
                    "Holt-Winters smoothing diverged with " + Arrays.toString(params));
        }

        state = new HoltWintersState(params[ALPHA], params[BETA], params[GAMMA],
                trendType, seasonalType, period,
                result.level, result.trend, result.lastSeason, result.fitted,
                result.sse / result.count, y.length,
                train.lastTimestamp(), train.getStep());
        LOG.info("Fitted Holt-Winters on {} points: alpha={} beta={} gamma={} sse={}",
                y.length, params[ALPHA], params[BETA], params[GAMMA], result.sse);
        return state;
    }

    @Override
    public Forecast forecast(int horizon, List<Integer> confidenceLevels) {
        Forecasts.requireHorizon(horizon);
        HoltWintersState fitted = requireState();

        double[] values = new double[horizon];
        double[] errors = new double[horizon];
        double sigma2 = fitted.getResidualVariance();
        double[] season = fitted.getSeason();
        double betaEffect = trendType == ComponentType.NONE ? 0 : fitted.getBeta();
        double gammaEffect = seasonalType == ComponentType.NONE ? 0 : fitted.getGamma();
        double accumulated = 1.0;

        for (int h = 1; h <= horizon; h++) {
            double base = switch (trendType) {
                case NONE -> fitted.getLevel();
                case ADDITIVE -> fitted.getLevel() + h * fitted.getTrend();
                case MULTIPLICATIVE -> fitted.getLevel() * Math.pow(fitted.getTrend(), h);
            };
            double seasonal = period > 0 ? season[(h - 1) % period] : neutralSeason();
            values[h - 1] = applySeason(base, seasonal);

            // Additive state-space approximation of the h-step error variance
            errors[h - 1] = Math.sqrt(sigma2 * accumulated);
            double c = fitted.getAlpha() * (1 + h * betaEffect)
                    + (period > 0 && h % period == 0 ? gammaEffect : 0);
            accumulated += c * c;
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
    // Smoothing
    // ---------------------------------------------------------------

    /** Result of one pass of the smoothing recursion. */
    private static final class Smoothing {
        double level;
        double trend;
        double[] lastSeason;
        double[] fitted;
        double sse;
        int count;
    }

    private Smoothing smooth(double[] y, double alpha, double beta, double gamma) {
        int n = y.length;
        int window = initWindow();

        SimpleRegression line = new SimpleRegression();
        for (int i = 0; i < window; i++) {
            line.addData(i, y[i]);
        }
        double slope = line.getSlope();
        double level = line.predict(window - 1);
        if (trendType == ComponentType.MULTIPLICATIVE && !(level > 0)) {
            level = y[window - 1];
        }
        double trend = switch (trendType) {
            case NONE -> 0.0;
            case ADDITIVE -> slope;
            case MULTIPLICATIVE -> 1 + slope / level > 0 ? 1 + slope / level : 1.0;
        };

        double[] season = new double[period > 0 ? n : 0];
        for (int i = 0; i < period; i++) {
            double onLine = line.predict(i);
            season[i] = seasonalType == ComponentType.ADDITIVE
                    ? y[i] - onLine
                    : (onLine > 0 ? y[i] / onLine : 1.0);
        }

        double sse = 0;
        double[] fitted = new double[n - window];
        for (int t = window; t < n; t++) {
            double previousSeason = period > 0 ? season[t - period] : neutralSeason();
            double base = trendType == ComponentType.MULTIPLICATIVE ? level * trend : level + trend;
            fitted[t - window] = applySeason(base, previousSeason);
            double error = y[t] - fitted[t - window];
            sse += error * error;

            double newLevel = alpha * removeSeason(y[t], previousSeason) + (1 - alpha) * base;
            if (trendType == ComponentType.ADDITIVE) {
                trend = beta * (newLevel - level) + (1 - beta) * trend;
            } else if (trendType == ComponentType.MULTIPLICATIVE) {
                trend = beta * (newLevel / level) + (1 - beta) * trend;
            }
            if (period > 0) {
                season[t] = seasonalType == ComponentType.ADDITIVE
                        ? gamma * (y[t] - base) + (1 - gamma) * previousSeason
                        : gamma * (y[t] / base) + (1 - gamma) * previousSeason;
            }
            level = newLevel;
        }

        Smoothing result = new Smoothing();
        result.level = level;
        result.trend = trend;
        result.lastSeason = period > 0 ? Arrays.copyOfRange(season, n - period, n) : new double[0];
        result.fitted = fitted;
        result.sse = sse;
        result.count = n - window;
        return result;
    }

    private double applySeason(double base, double seasonal) {
        return switch (seasonalType) {
            case NONE -> base;
            case ADDITIVE -> base + seasonal;
            case MULTIPLICATIVE -> base * seasonal;
        };
    }

    private double removeSeason(double value, double seasonal) {
        return switch (seasonalType) {
            case NONE -> value;
            case ADDITIVE -> value - seasonal;
            case MULTIPLICATIVE -> value / seasonal;
        };
    }

    private double neutralSeason() {
        return seasonalType == ComponentType.MULTIPLICATIVE ? 1.0 : 0.0;
    }

    private int initWindow() {
        return period > 0 ? period : 2;
    }

    // ---------------------------------------------------------------
    // Parameter optimization
    // ---------------------------------------------------------------

    private double[] resolveParameters(double[] y) {
        double[] params = {
                fixedAlpha != null ? fixedAlpha : Double.NaN,
                trendType == ComponentType.NONE ? 0.0 : (fixedBeta != null ? fixedBeta : Double.NaN),
                seasonalType == ComponentType.NONE ? 0.0 : (fixedGamma != null ? fixedGamma : Double.NaN)
        };
        int[] free = freeIndices(params);
        if (free.length == 0) {
            return params;
        }

        // Coarse grid for a starting point
        double[] best = params.clone();
        double bestSse = Double.POSITIVE_INFINITY;
        int combinations = (int) Math.pow(GRID.length, free.length);
        for (int combination = 0; combination < combinations; combination++) {
            double[] candidate = params.clone();
            int code = combination;
            for (int index : free) {
                candidate[index] = GRID[code % GRID.length];
                code /= GRID.length;
            }
            double value = objective(y, candidate);
            if (value < bestSse) {
                bestSse = value;
                best = candidate;
            }
        }

        double[] refined;
        try {
            refined = free.length == 1
                    ? refineOne(y, best, free[0])
                    : refineMany(y, best, free);
        } catch (TooManyEvaluationsException e) {
            throw new NonConvergenceException(
                    "Holt-Winters parameter search exceeded " + maxEvaluations + " evaluations", e);
        }

        double refinedSse = objective(y, refined);
        LOG.debug("Holt-Winters parameter search: grid sse={} refined sse={} params={}",
                bestSse, refinedSse, Arrays.toString(refined));
        return refinedSse <= bestSse ? refined : best;
    }

    private double[] refineOne(double[] y, double[] start, int index) {
        BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-12);
        UnivariatePointValuePair optimum = optimizer.optimize(
                new MaxEval(maxEvaluations),
                new UnivariateObjectiveFunction(x -> objective(y, with(start, index, x))),
                GoalType.MINIMIZE,
                new SearchInterval(MIN_SMOOTHING, MAX_SMOOTHING, start[index]));
        return with(start, index, optimum.getPoint());
    }

    private double[] refineMany(double[] y, double[] start, int[] free) {
        double[] initial = new double[free.length];
        double[] lower = new double[free.length];
        double[] upper = new double[free.length];
        for (int i = 0; i < free.length; i++) {
            initial[i] = start[free[i]];
            lower[i] = MIN_SMOOTHING;
            upper[i] = MAX_SMOOTHING;
        }

        BOBYQAOptimizer optimizer = new BOBYQAOptimizer(2 * free.length + 1, 0.1, 1e-6);
        PointValuePair optimum = optimizer.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(point -> objective(y, merge(start, free, point))),
                GoalType.MINIMIZE,
                new InitialGuess(initial),
                new SimpleBounds(lower, upper));
        return merge(start, free, optimum.getPoint());
    }

    private double objective(double[] y, double[] params) {
        double sse = smooth(y, params[ALPHA], params[BETA], params[GAMMA]).sse;
        return Double.isFinite(sse) ? sse : Double.MAX_VALUE;
    }

    private static int[] freeIndices(double[] params) {
        return IntStream.range(0, params.length)
                .filter(i -> Double.isNaN(params[i]))
                .toArray();
    }

    private static double[] with(double[] params, int index, double value) {
        double[] copy = params.clone();
        copy[index] = value;
        return copy;
    }

    private static double[] merge(double[] params, int[] free, double[] values) {
        double[] copy = params.clone();
        for (int i = 0; i < free.length; i++) {
            copy[free[i]] = values[i];
        }
        return copy;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static void requirePositive(Series train) {
        for (DataPoint point : train.getPoints()) {
            Double value = point.getValue();
            if (value != null && value <= 0) {
                throw new IllegalArgumentException(
                        "Multiplicative Holt-Winters requires strictly positive values, got "
                                + value + " at " + point.getTimestamp());
            }
        }
    }

    private HoltWintersState requireState() {
        if (state == null) {
            throw new IllegalStateException("Holt-Winters model has not been fit");
        }
        return state;
    }
}
