package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Output of a seasonal decomposition.
 *
 * <p>
 * The four component arrays always have the same length as the input.
 * {@code trend} and {@code residual} hold {@link Double#NaN} at the edges
 * where the centred moving-average window does not fit.
 * </p>
 *
 * <p>
 * {@code trendStrength}, {@code seasonalStrength} and {@code noiseRatio} are
 * all in {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "mode", "period", "observed", "trend", "seasonal", "residual",
        "trend_strength", "seasonal_strength", "noise_ratio" })
public final class DecompositionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DecompositionMode mode;
    private final int period;
    private final double[] observed;
    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;
    private final double trendStrength;
    private final double seasonalStrength;
    private final double noiseRatio;

    private DecompositionResult(Builder b) {
        this.mode = Objects.requireNonNull(b.mode, "mode must not be null");
        this.observed = Objects.requireNonNull(b.observed, "observed must not be null").clone();
        this.trend = Objects.requireNonNull(b.trend, "trend must not be null").clone();
        this.seasonal = Objects.requireNonNull(b.seasonal, "seasonal must not be null").clone();
        this.residual = Objects.requireNonNull(b.residual, "residual must not be null").clone();
        int n = observed.length;
        if (trend.length != n || seasonal.length != n || residual.length != n) {
            throw new IllegalArgumentException("All decomposition components must have length " + n);
        }
        this.period = b.period;
        this.trendStrength = b.trendStrength;
        this.seasonalStrength = b.seasonalStrength;
        this.noiseRatio = b.noiseRatio;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; {@code mode} and all four components are required.
     */
    public static class Builder {
        private DecompositionMode mode;
        private int period;
        private double[] observed;
        private double[] trend;
        private double[] seasonal;
        private double[] residual;
        private double trendStrength;
        private double seasonalStrength;
        private double noiseRatio;

        public Builder mode(DecompositionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder observed(double[] observed) {
            this.observed = observed;
            return this;
        }

        public Builder trend(double[] trend) {
            this.trend = trend;
            return this;
        }

        public Builder seasonal(double[] seasonal) {
            this.seasonal = seasonal;
            return this;
        }

        public Builder residual(double[] residual) {
            this.residual = residual;
            return this;
        }

        public Builder trendStrength(double trendStrength) {
            this.trendStrength = trendStrength;
            return this;
        }

        public Builder seasonalStrength(double seasonalStrength) {
            this.seasonalStrength = seasonalStrength;
            return this;
        }

        public Builder noiseRatio(double noiseRatio) {
            this.noiseRatio = noiseRatio;
            return this;
        }

        public DecompositionResult build() {
            return new DecompositionResult(this);
        }
    }

    @JsonProperty("mode")
    public DecompositionMode getMode() {
        return mode;
    }

    /**
     * @return the seasonal period used, either supplied or detected
     */
    @JsonProperty("period")
    public int getPeriod() {
        return period;
    }

    @JsonProperty("observed")
    public double[] getObserved() {
        return observed.clone();
    }

    @JsonProperty("trend")
    public double[] getTrend() {
        return trend.clone();
    }

    @JsonProperty("seasonal")
    public double[] getSeasonal() {
        return seasonal.clone();
    }

    @JsonProperty("residual")
    public double[] getResidual() {
        return residual.clone();
    }

    @JsonProperty("trend_strength")
    public double getTrendStrength() {
        return trendStrength;
    }

    @JsonProperty("seasonal_strength")
    public double getSeasonalStrength() {
        return seasonalStrength;
    }

    /**
     * @return share of the observed variance left in the residual
     */
    @JsonProperty("noise_ratio")
    public double getNoiseRatio() {
        return noiseRatio;
    }

    public int size() {
        return observed.length;
    }

    @Override
    public String toString() {
        return "DecompositionResult{" +
                "mode=" + mode +
                ", period=" + period +
                ", size=" + observed.length +
                ", trendStrength=" + trendStrength +
                ", seasonalStrength=" + seasonalStrength +
                ", noiseRatio=" + noiseRatio +
                '}';
    }
}
