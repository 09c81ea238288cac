package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.error.InsufficientDataException;
import com.forecastsentinel.core.error.NonConvergenceException;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Conditional sum of squares estimation of ARMA coefficients on an already
 * differenced, mean-adjusted series.
 *
 * <h3>Algorithm</h3>
 * <ul>
 * <li>Pure autoregressions are solved directly by ordinary least squares on
 * the lagged values.</li>
 * <li>With moving-average terms, a Hannan-Rissanen regression supplies the
 * starting point: a long autoregression approximates the innovations, which
 * then serve as regressors for the MA lags. Levenberg-Marquardt refines the
 * coefficients against the exact residual recursion and its analytic
 * Jacobian.</li>
 * </ul>
 *
 * <p>
 * Residuals before the first usable index (the largest AR lag) are taken to
 * be zero. A rank-deficient design, such as the all-zero lags of a flat
 * series, is solved for the minimum-norm coefficients; zero lagged variance
 * therefore yields {@code phi = 0}.
 * </p>
 */
final class ArimaEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaEstimator.class);

    /** Upper bound on the order of the Hannan-Rissanen long autoregression. */
    private static final int MAX_LONG_AR_ORDER = 20;

    /** Starting MA coefficients are clamped into (-0.9, 0.9). */
    private static final double MAX_START_THETA = 0.9;

    /** Pivot threshold of the QR solve, relative to the design's norm. */
    private static final double RELATIVE_SINGULARITY_THRESHOLD = 1e-10;

    private ArimaEstimator() {
        // utility class, not instantiable
    }

    /** Estimated coefficients with their in-sample residuals. */
    static final class Estimate {
        final double[] phi;
        final double[] theta;
        final double[] residuals;
        final double css;
        final double sigma2;

        Estimate(double[] phi, double[] theta, double[] residuals, double css, double sigma2) {
            this.phi = phi;
            this.theta = theta;
            this.residuals = residuals;
            this.css = css;
            this.sigma2 = sigma2;
        }
    }

    /**
     * @param z              differenced series with its mean removed
     * @param arLags         autoregressive lags in ascending order
     * @param maLags         moving-average lags in ascending order
     * @param maxIterations  iteration and evaluation budget of the optimizer
     * @throws InsufficientDataException if fewer usable points remain than
     *                                   coefficients to estimate
     * @throws NonConvergenceException   if the optimizer exhausts its budget or
     *                                   ends worse than it started
     */
    static Estimate estimate(double[] z, int[] arLags, int[] maLags, int maxIterations) {
        int maxAr = arLags.length == 0 ? 0 : arLags[arLags.length - 1];
        int k = arLags.length + maLags.length;
        int effective = z.length - maxAr;
        if (effective <= k) {
            throw new InsufficientDataException(
                    "Not enough observations after differencing to estimate " + k + " coefficients",
                    maxAr + k + 1, z.length);
        }

        if (maLags.length == 0) {
            double[] phi = arLags.length == 0 ? new double[0] : leastSquaresAr(z, arLags, maxAr);
            return finish(z, arLags, maLags, phi, new double[0]);
        }

        double[] start = hannanRissanen(z, arLags, maLags);
        double initialCss = css(z, arLags, maLags, start);

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(residualModel(z, arLags, maLags))
                .target(new double[effective])
                .lazyEvaluation(false)
                .maxIterations(maxIterations)
                .maxEvaluations(maxIterations)
                .build();

        double[] solution;
        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            solution = optimum.getPoint().toArray();
            LOG.debug("Levenberg-Marquardt finished after {} iterations and {} evaluations",
                    optimum.getIterations(), optimum.getEvaluations());
        } catch (TooManyEvaluationsException | TooManyIterationsException e) {
            throw new NonConvergenceException(
                    "ARIMA estimation did not converge within " + maxIterations + " iterations", e);
        } catch (ConvergenceException e) {
            throw new NonConvergenceException("ARIMA estimation failed to converge: " + e.getMessage(), e);
        }

        double finalCss = css(z, arLags, maLags, solution);
        if (!Double.isFinite(finalCss) || finalCss > initialCss) {
            throw new NonConvergenceException(
                    "ARIMA estimation diverged: css went from " + initialCss + " to " + finalCss);
        }
        return finish(z, arLags, maLags,
                Arrays.copyOfRange(solution, 0, arLags.length),
                Arrays.copyOfRange(solution, arLags.length, solution.length));
    }

    // ---------------------------------------------------------------
    // Residual recursion
    // ---------------------------------------------------------------

    /**
     * e[t] = z[t] - sum(phi_i * z[t - arLag_i]) - sum(theta_j * e[t - maLag_j])
     * for t at or after the largest AR lag; zero before.
     */
    static double[] residuals(double[] z, int[] arLags, int[] maLags, double[] phi, double[] theta) {
        int start = arLags.length == 0 ? 0 : arLags[arLags.length - 1];
        double[] e = new double[z.length];
        for (int t = start; t < z.length; t++) {
            double value = z[t];
            for (int i = 0; i < arLags.length; i++) {
                value -= phi[i] * z[t - arLags[i]];
            }
            for (int j = 0; j < maLags.length; j++) {
                if (t - maLags[j] >= 0) {
                    value -= theta[j] * e[t - maLags[j]];
                }
            }
            e[t] = value;
        }
        return e;
    }

    private static double css(double[] z, int[] arLags, int[] maLags, double[] params) {
        double[] e = residuals(z, arLags, maLags,
                Arrays.copyOfRange(params, 0, arLags.length),
                Arrays.copyOfRange(params, arLags.length, params.length));
        double sum = 0;
        for (double value : e) {
            sum += value * value;
        }
        return sum;
    }

    private static MultivariateJacobianFunction residualModel(double[] z, int[] arLags, int[] maLags) {
        int start = arLags.length == 0 ? 0 : arLags[arLags.length - 1];
        int k = arLags.length + maLags.length;
        return point -> {
            double[] params = point.toArray();
            double[] phi = Arrays.copyOfRange(params, 0, arLags.length);
            double[] theta = Arrays.copyOfRange(params, arLags.length, k);
            double[] e = residuals(z, arLags, maLags, phi, theta);

            // de[t][c] = derivative of e[t] with respect to coefficient c
            double[][] de = new double[z.length][k];
            for (int t = start; t < z.length; t++) {
                for (int i = 0; i < arLags.length; i++) {
                    de[t][i] = -z[t - arLags[i]];
                }
                for (int j = 0; j < maLags.length; j++) {
                    if (t - maLags[j] >= 0) {
                        de[t][arLags.length + j] = -e[t - maLags[j]];
                    }
                }
                for (int j = 0; j < maLags.length; j++) {
                    int lagged = t - maLags[j];
                    if (lagged < 0) {
                        continue;
                    }
                    for (int c = 0; c < k; c++) {
                        de[t][c] -= theta[j] * de[lagged][c];
                    }
                }
            }

            RealVector value = new ArrayRealVector(Arrays.copyOfRange(e, start, z.length), false);
            RealMatrix jacobian = new Array2DRowRealMatrix(Arrays.copyOfRange(de, start, z.length), false);
            return new Pair<>(value, jacobian);
        };
    }

    // ---------------------------------------------------------------
    // Linear regressions
    // ---------------------------------------------------------------

    private static double[] leastSquaresAr(double[] z, int[] arLags, int maxAr) {
        int rows = z.length - maxAr;
        double[] target = new double[rows];
        double[][] design = new double[rows][arLags.length];
        for (int t = maxAr; t < z.length; t++) {
            target[t - maxAr] = z[t];
            for (int i = 0; i < arLags.length; i++) {
                design[t - maxAr][i] = z[t - arLags[i]];
            }
        }
        return regress(target, design);
    }

    /**
     * Hannan-Rissanen starting values, or zeros when the auxiliary
     * regressions cannot be solved.
     */
    private static double[] hannanRissanen(double[] z, int[] arLags, int[] maLags) {
        int k = arLags.length + maLags.length;
        int maxAr = arLags.length == 0 ? 0 : arLags[arLags.length - 1];
        int maxMa = maLags[maLags.length - 1];
        int longOrder = Math.max(maxAr + maxMa, Math.min(MAX_LONG_AR_ORDER, z.length / 5));

        try {
            int[] longLags = new int[longOrder];
            for (int i = 0; i < longOrder; i++) {
                longLags[i] = i + 1;
            }
            double[] longPhi = leastSquaresAr(z, longLags, longOrder);
            double[] innovations = residuals(z, longLags, new int[0], longPhi, new double[0]);

            int first = Math.max(maxAr, longOrder + maxMa);
            int rows = z.length - first;
            if (rows <= k) {
                LOG.debug("Too few rows ({}) for the Hannan-Rissanen regression, starting from zero", rows);
                return new double[k];
            }
            double[] target = new double[rows];
            double[][] design = new double[rows][k];
            for (int t = first; t < z.length; t++) {
                target[t - first] = z[t];
                for (int i = 0; i < arLags.length; i++) {
                    design[t - first][i] = z[t - arLags[i]];
                }
                for (int j = 0; j < maLags.length; j++) {
                    design[t - first][arLags.length + j] = innovations[t - maLags[j]];
                }
            }
            double[] start = regress(target, design);
            for (int j = arLags.length; j < k; j++) {
                start[j] = Math.max(-MAX_START_THETA, Math.min(MAX_START_THETA, start[j]));
            }
            return start;
        } catch (MathIllegalArgumentException e) {
            LOG.debug("Hannan-Rissanen start failed ({}), starting from zero", e.getMessage());
            return new double[k];
        }
    }

    private static double[] regress(double[] target, double[][] design) {
        RealMatrix x = new Array2DRowRealMatrix(design, false);
        OLSMultipleLinearRegression regression =
                new OLSMultipleLinearRegression(RELATIVE_SINGULARITY_THRESHOLD * x.getFrobeniusNorm());
        regression.setNoIntercept(true);
        regression.newSampleData(target, design);
        try {
            return regression.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            LOG.debug("Rank-deficient design ({} x {}), using the minimum-norm solution",
                    design.length, design[0].length);
            return new SingularValueDecomposition(x).getSolver()
                    .solve(new ArrayRealVector(target, false))
                    .toArray();
        }
    }

    private static Estimate finish(double[] z, int[] arLags, int[] maLags, double[] phi, double[] theta) {
        int start = arLags.length == 0 ? 0 : arLags[arLags.length - 1];
        double[] e = residuals(z, arLags, maLags, phi, theta);
        double css = 0;
        for (int t = start; t < z.length; t++) {
            css += e[t] * e[t];
        }
        return new Estimate(phi, theta, e, css, css / (z.length - start));
    }
}
