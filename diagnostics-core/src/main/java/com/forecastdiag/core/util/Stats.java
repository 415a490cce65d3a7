package com.forecastdiag.core.util;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive helpers shared by the analysis components.
 *
 * <p>
 * Percentiles use linear interpolation between order statistics
 * ({@link EstimationType#R_7}), the convention of most numeric environments.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    private Stats() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Argument checks
    // ---------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double[] requireNonEmpty(double[] values, String name) {
        Objects.requireNonNull(values, name + " must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return values;
    }

    /**
     * @throws IllegalArgumentException if {@code level} is not strictly between
     *                                  0 and 1
     */
    public static double requireLevel(double level) {
        if (!(level > 0 && level < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1), got: " + level);
        }
        return level;
    }

    // ---------------------------------------------------------------
    // Moments
    // ---------------------------------------------------------------

    public static double mean(double[] values) {
        return StatUtils.mean(values);
    }

    /** Population variance (divisor n). */
    public static double populationVariance(double[] values) {
        return StatUtils.populationVariance(values);
    }

    public static double populationStd(double[] values) {
        return Math.sqrt(StatUtils.populationVariance(values));
    }

    /** Sample standard deviation (divisor n - 1); 0 for a single value. */
    public static double sampleStd(double[] values) {
        return Math.sqrt(StatUtils.variance(values));
    }

    /**
     * Population variance over the finite entries only.
     *
     * @return the variance, or {@link Double#NaN} if no entry is finite
     */
    public static double finiteVariance(double[] values) {
        double[] finite = finite(values);
        return finite.length == 0 ? Double.NaN : StatUtils.populationVariance(finite);
    }

    /**
     * @return a new array with the non-finite entries removed
     */
    public static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    // ---------------------------------------------------------------
    // Order statistics
    // ---------------------------------------------------------------

    /**
     * Linear-interpolation percentile.
     *
     * @param values data; not modified
     * @param p      percentile in (0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double p) {
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }
}
