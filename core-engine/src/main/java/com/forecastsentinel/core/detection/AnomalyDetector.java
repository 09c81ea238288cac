package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.error.DegenerateWindowException;
import com.forecastsentinel.core.model.AnomalyFlag;
import com.forecastsentinel.core.model.Residual;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolling z-score detector over forecast residuals.
 *
 * <p>
 * Each residual is compared against the mean and sample standard deviation
 * of the window made of itself and the up to {@code windowSize - 1}
 * residuals before it. The residual is an anomaly when {@code |z| > delta}.
 * Exactly one {@link AnomalyFlag} is emitted per residual.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * For the first {@code windowSize - 1} residuals the window shrinks to
 * whatever has been seen so far. The first residual is alone in its window
 * and gets {@code z = 0}.
 * </p>
 *
 * <h3>Degenerate windows</h3>
 * <p>
 * A window of identical residuals has zero spread and scores {@code z = 0}.
 * When the values differ but the computed standard deviation still
 * underflows to zero, the residual gets {@code z = ±∞} and is flagged. In
 * strict mode a {@link DegenerateWindowException} is thrown instead.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final boolean strict;

    public AnomalyDetector() {
        this(false);
    }

    /**
     * @param strict throw on a degenerate window instead of flagging it
     */
    public AnomalyDetector(boolean strict) {
        this.strict = strict;
    }

    /**
     * @param residuals  chronologically ordered residuals
     * @param windowSize maximum number of residuals in the window, current included
     * @param delta      z-score threshold
     * @return one flag per residual, in the same order
     * @throws IllegalArgumentException   if {@code windowSize < 1}
     * @throws DegenerateWindowException  in strict mode, on a zero-variance
     *                                    window with a deviating residual
     */
    public List<AnomalyFlag> detect(List<Residual> residuals, int windowSize, double delta) {
        Objects.requireNonNull(residuals, "residuals must not be null");
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }

        DescriptiveStatistics window = new DescriptiveStatistics(windowSize);
        List<AnomalyFlag> flags = new ArrayList<>(residuals.size());

        for (Residual residual : residuals) {
            double value = residual.getError();
            window.addValue(value);

            double mean = window.getMean();
            double std = window.getStandardDeviation();
            double deviation = value - mean;
            double z;
            if (window.getMin() == window.getMax()) {
                z = 0.0;
                std = 0.0;
            } else if (std > 0) {
                z = deviation / std;
            } else if (deviation == 0) {
                z = 0.0;
            } else {
                if (strict) {
                    throw new DegenerateWindowException(residual.getTimestamp(), value, mean);
                }
                LOG.warn("Zero-variance window at {}: residual {} deviates from window mean {}",
                        residual.getTimestamp(), value, mean);
                z = deviation > 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            }

            boolean anomalous = Math.abs(z) > delta;
            if (anomalous) {
                LOG.debug("Anomaly at {}: residual={} mean={} std={} z={}",
                        residual.getTimestamp(), value, mean, std, z);
            }
            flags.add(new AnomalyFlag(residual.getTimestamp(), value, mean, std, z, anomalous));
        }

        LOG.debug("Evaluated {} residuals, {} flagged", flags.size(),
                flags.stream().filter(AnomalyFlag::isAnomalous).count());
        return flags;
    }

    public boolean isStrict() {
        return strict;
    }
}
