package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * A {@code (lower, upper)} interval together with the confidence level that
 * produced it.
 *
 * <p>
 * The bounds are stored as computed. Lower is at most upper for every
 * well-formed input; a negative standard error passed to a prediction
 * interval yields an inverted pair and is not corrected here.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "lower", "upper", "confidence_level" })
public final class Interval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double lower;
    private final double upper;
    private final double confidenceLevel;

    /**
     * @param lower           lower bound
     * @param upper           upper bound
     * @param confidenceLevel level in the open interval (0, 1)
     * @throws IllegalArgumentException if {@code confidenceLevel} is outside
     *                                  (0, 1)
     */
    public Interval(double lower, double upper, double confidenceLevel) {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException(
                    "confidenceLevel must be in (0, 1), got: " + confidenceLevel);
        }
        this.lower = lower;
        this.upper = upper;
        this.confidenceLevel = confidenceLevel;
    }

    @JsonProperty("lower")
    public double getLower() {
        return lower;
    }

    @JsonProperty("upper")
    public double getUpper() {
        return upper;
    }

    @JsonProperty("confidence_level")
    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public double width() {
        return upper - lower;
    }

    public double midpoint() {
        return (lower + upper) / 2.0;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Interval that))
            return false;
        return Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0
                && Double.compare(confidenceLevel, that.confidenceLevel) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper, confidenceLevel);
    }

    @Override
    public String toString() {
        return "Interval{lower=" + lower + ", upper=" + upper
                + ", confidenceLevel=" + confidenceLevel + '}';
    }
}
