package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

/**
 * Dispersion summary of a demand series.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "coefficient_of_variation", "standard_deviation", "variance",
        "volatility_score", "relative_volatility", "mean" })
public final class VolatilityReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mean;
    private final double standardDeviation;
    private final double variance;
    private final double coefficientOfVariation;

    public VolatilityReport(double mean, double standardDeviation, double variance,
            double coefficientOfVariation) {
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.variance = variance;
        this.coefficientOfVariation = coefficientOfVariation;
    }

    @JsonProperty("mean")
    public double getMean() {
        return mean;
    }

    /** Sample standard deviation (n - 1). */
    @JsonProperty("standard_deviation")
    public double getStandardDeviation() {
        return standardDeviation;
    }

    @JsonProperty("variance")
    public double getVariance() {
        return variance;
    }

    @JsonProperty("coefficient_of_variation")
    public double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    /**
     * @return coefficient of variation capped at 2 and scaled to [0, 1]
     */
    @JsonProperty("volatility_score")
    public double getVolatilityScore() {
        return Math.min(coefficientOfVariation, 2.0) / 2.0;
    }

    /**
     * @return coefficient of variation relative to a 20% baseline
     */
    @JsonProperty("relative_volatility")
    public double getRelativeVolatility() {
        return coefficientOfVariation > 0 ? coefficientOfVariation / 0.2 : 0.0;
    }

    @Override
    public String toString() {
        return "VolatilityReport{mean=" + mean +
                ", standardDeviation=" + standardDeviation +
                ", coefficientOfVariation=" + coefficientOfVariation +
                '}';
    }
}
