package com.forecastdiag.core.accuracy;

import com.forecastdiag.core.model.VolatilityReport;
import com.forecastdiag.core.util.Stats;

import java.util.Locale;
import java.util.Objects;

/**
 * Volatility measures for a demand series.
 *
 * @since 1.0.0
 */
public final class VolatilityCalculator {

    /** Span of the exponentially weighted variance of relative changes. */
    public static final int EWMA_SPAN = 20;

    /**
     * Volatility by method name: {@code std} (population standard deviation)
     * or {@code ewma}. Unknown names fall back to {@code std}.
     *
     * @param values series values
     * @param method method name
     * @return the volatility measure
     */
    public double volatility(double[] values, String method) {
        Objects.requireNonNull(method, "method must not be null");
        if ("ewma".equals(method.toLowerCase(Locale.ROOT))) {
            return ewma(values);
        }
        return std(values);
    }

    public double std(double[] values) {
        Stats.requireNonEmpty(values, "values");
        return Stats.populationStd(values);
    }

    /**
     * Square root of the last exponentially weighted variance of the relative
     * changes {@code (x[t] - x[t-1]) / x[t-1]}.
     *
     * <p>
     * The weighted variance is the bias-corrected form with weights
     * {@code (1 - alpha)^i}, {@code alpha = 2 / (span + 1)}, over all changes.
     * With two values there is a single change and no variance, so the
     * result is NaN.
     * </p>
     *
     * @throws IllegalArgumentException if fewer than two values are given or
     *                                  a preceding value is zero
     */
    public double ewma(double[] values) {
        Stats.requireNonEmpty(values, "values");
        if (values.length < 2) {
            throw new IllegalArgumentException("EWMA volatility needs at least 2 values, got: " + values.length);
        }
        double[] changes = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] == 0) {
                throw new IllegalArgumentException("EWMA volatility is undefined after a zero value at index "
                        + (i - 1));
            }
            changes[i - 1] = (values[i] - values[i - 1]) / values[i - 1];
        }

        int m = changes.length;
        if (m < 2) {
            return Double.NaN;
        }
        double alpha = 2.0 / (EWMA_SPAN + 1);
        double sumW = 0;
        double sumW2 = 0;
        double weightedMean = 0;
        double[] weights = new double[m];
        for (int i = 0; i < m; i++) {
            // newest observation carries weight 1
            weights[i] = Math.pow(1 - alpha, m - 1 - i);
            sumW += weights[i];
            sumW2 += weights[i] * weights[i];
            weightedMean += weights[i] * changes[i];
        }
        weightedMean /= sumW;
        double weightedSq = 0;
        for (int i = 0; i < m; i++) {
            double d = changes[i] - weightedMean;
            weightedSq += weights[i] * d * d;
        }
        double correction = sumW * sumW - sumW2;
        if (correction <= 0) {
            return Double.NaN;
        }
        return Math.sqrt(weightedSq * sumW / correction);
    }

    /**
     * @param values series values, at least two
     * @return coefficient of variation and related measures
     * @throws IllegalArgumentException if fewer than two values are given
     */
    public VolatilityReport summarize(double[] values) {
        Stats.requireNonEmpty(values, "values");
        if (values.length < 2) {
            throw new IllegalArgumentException("Volatility summary needs at least 2 values, got: "
                    + values.length);
        }
        double mean = Stats.mean(values);
        double std = Stats.sampleStd(values);
        double cv = mean != 0 ? std / mean : 0.0;
        return new VolatilityReport(mean, std, std * std, cv);
    }
}
