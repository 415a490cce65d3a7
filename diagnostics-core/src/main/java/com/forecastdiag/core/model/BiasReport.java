package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Detailed forecast-bias diagnostics.
 *
 * <p>
 * All error quantities use {@code forecast - actual}, so a positive bias is
 * over-forecasting. Percentage errors are taken over positions where the
 * actual value is non-zero and are {@link Double#NaN} when there are none.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "mean_bias", "median_bias", "mean_absolute_error", "mean_percentage_error",
        "mean_absolute_percentage_error", "weighted_bias", "bias_direction", "is_systematic",
        "bias_consistency", "p_value", "t_statistic", "sample_size" })
public final class BiasReport implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Sign of the mean bias. */
    public enum Direction {
        OVER, UNDER, NEUTRAL;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final double meanBias;
    private final double medianBias;
    private final double meanAbsoluteError;
    private final double meanPercentageError;
    private final double meanAbsolutePercentageError;
    private final double weightedBias;
    private final Direction direction;
    private final double biasConsistency;
    private final double tStatistic;
    private final double pValue;
    private final int sampleSize;

    private BiasReport(Builder b) {
        this.meanBias = b.meanBias;
        this.medianBias = b.medianBias;
        this.meanAbsoluteError = b.meanAbsoluteError;
        this.meanPercentageError = b.meanPercentageError;
        this.meanAbsolutePercentageError = b.meanAbsolutePercentageError;
        this.weightedBias = b.weightedBias;
        this.direction = Objects.requireNonNull(b.direction, "direction must not be null");
        this.biasConsistency = b.biasConsistency;
        this.tStatistic = b.tStatistic;
        this.pValue = b.pValue;
        this.sampleSize = b.sampleSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double meanBias;
        private double medianBias;
        private double meanAbsoluteError;
        private double meanPercentageError;
        private double meanAbsolutePercentageError;
        private double weightedBias;
        private Direction direction;
        private double biasConsistency;
        private double tStatistic;
        private double pValue;
        private int sampleSize;

        public Builder meanBias(double meanBias) {
            this.meanBias = meanBias;
            return this;
        }

        public Builder medianBias(double medianBias) {
            this.medianBias = medianBias;
            return this;
        }

        public Builder meanAbsoluteError(double meanAbsoluteError) {
            this.meanAbsoluteError = meanAbsoluteError;
            return this;
        }

        public Builder meanPercentageError(double meanPercentageError) {
            this.meanPercentageError = meanPercentageError;
            return this;
        }

        public Builder meanAbsolutePercentageError(double meanAbsolutePercentageError) {
            this.meanAbsolutePercentageError = meanAbsolutePercentageError;
            return this;
        }

        public Builder weightedBias(double weightedBias) {
            this.weightedBias = weightedBias;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder biasConsistency(double biasConsistency) {
            this.biasConsistency = biasConsistency;
            return this;
        }

        public Builder tStatistic(double tStatistic) {
            this.tStatistic = tStatistic;
            return this;
        }

        public Builder pValue(double pValue) {
            this.pValue = pValue;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public BiasReport build() {
            return new BiasReport(this);
        }
    }

    @JsonProperty("mean_bias")
    public double getMeanBias() {
        return meanBias;
    }

    @JsonProperty("median_bias")
    public double getMedianBias() {
        return medianBias;
    }

    @JsonProperty("mean_absolute_error")
    public double getMeanAbsoluteError() {
        return meanAbsoluteError;
    }

    @JsonProperty("mean_percentage_error")
    public double getMeanPercentageError() {
        return meanPercentageError;
    }

    @JsonProperty("mean_absolute_percentage_error")
    public double getMeanAbsolutePercentageError() {
        return meanAbsolutePercentageError;
    }

    @JsonProperty("weighted_bias")
    public double getWeightedBias() {
        return weightedBias;
    }

    @JsonProperty("bias_direction")
    public Direction getDirection() {
        return direction;
    }

    /**
     * @return {@code true} when the t-test rejects a zero mean error at the 5%
     *         level
     */
    @JsonProperty("is_systematic")
    public boolean isSystematic() {
        return pValue < 0.05;
    }

    /**
     * @return population standard deviation of the errors; lower is more
     *         consistent
     */
    @JsonProperty("bias_consistency")
    public double getBiasConsistency() {
        return biasConsistency;
    }

    @JsonProperty("t_statistic")
    public double getTStatistic() {
        return tStatistic;
    }

    @JsonProperty("p_value")
    public double getPValue() {
        return pValue;
    }

    @JsonProperty("sample_size")
    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public String toString() {
        return "BiasReport{" +
                "meanBias=" + meanBias +
                ", direction=" + direction +
                ", tStatistic=" + tStatistic +
                ", pValue=" + pValue +
                ", sampleSize=" + sampleSize +
                '}';
    }
}
