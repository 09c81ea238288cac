package com.forecastsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of the rolling z-score check for one residual.
 *
 * <p>
 * One flag is produced per residual, anomalous or not, so a flag sequence is
 * always aligned with the residual series it was computed from. A degenerate
 * window (zero spread, non-zero deviation) yields an infinite z-score whose
 * sign matches the deviation.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyFlag implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double residual;
    private final double rollingMean;
    private final double rollingStd;
    private final double zScore;
    private final boolean anomalous;

    public AnomalyFlag(Instant timestamp, double residual, double rollingMean,
                       double rollingStd, double zScore, boolean anomalous) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.residual = residual;
        this.rollingMean = rollingMean;
        this.rollingStd = rollingStd;
        this.zScore = zScore;
        this.anomalous = anomalous;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getResidual() {
        return residual;
    }

    public double getRollingMean() {
        return rollingMean;
    }

    public double getRollingStd() {
        return rollingStd;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyFlag that))
            return false;
        return anomalous == that.anomalous
                && Double.compare(residual, that.residual) == 0
                && Double.compare(zScore, that.zScore) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, residual, zScore, anomalous);
    }

    @Override
    public String toString() {
        return "AnomalyFlag{" +
                "timestamp=" + timestamp +
                ", residual=" + residual +
                ", zScore=" + zScore +
                ", anomalous=" + anomalous +
                '}';
    }
}
