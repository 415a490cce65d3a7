package com.forecastdiag.core.decomposition;

import com.forecastdiag.core.util.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the seasonal period of a series from its autocorrelation.
 *
 * <p>
 * The autocorrelation function is evaluated up to
 * {@code min(n / 2, }{@value #MAX_LAGS}{@code )} lags. The first lag whose
 * autocorrelation is strictly greater than at both neighbouring lags is the
 * period. Without such a local maximum, or for a constant series, the period
 * defaults to {@value #DEFAULT_PERIOD}.
 * </p>
 *
 * @since 1.0.0
 */
public class PeriodicityEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(PeriodicityEstimator.class);

    public static final int MAX_LAGS = 40;
    public static final int DEFAULT_PERIOD = 12;

    /**
     * @param values series values; non-finite entries are dropped first
     * @return the estimated period, {@code >= 1}
     */
    public int estimate(double[] values) {
        Stats.requireNonEmpty(values, "values");
        double[] clean = Stats.finite(values);
        int lags = Math.min(clean.length / 2, MAX_LAGS);
        double[] acf = autocorrelation(clean, lags);

        for (int i = 1; i < acf.length - 1; i++) {
            if (acf[i] > acf[i - 1] && acf[i] > acf[i + 1]) {
                LOG.debug("Detected seasonal period {} from {} autocorrelation lag(s)", i, lags);
                return i;
            }
        }
        LOG.debug("No autocorrelation peak within {} lag(s); defaulting period to {}", lags, DEFAULT_PERIOD);
        return DEFAULT_PERIOD;
    }

    /**
     * Sample autocorrelation for lags {@code 0..maxLag}.
     *
     * <p>
     * Uses the biased estimator (every lag divided by the lag-0 sum of
     * squares). A series without variance has no defined autocorrelation and
     * yields an empty array.
     * </p>
     *
     * @param values finite series values
     * @param maxLag largest lag, {@code >= 0}
     * @return autocorrelations, {@code acf[0] == 1}, or an empty array
     */
    public double[] autocorrelation(double[] values, int maxLag) {
        if (maxLag < 0) {
            throw new IllegalArgumentException("maxLag must be >= 0, got: " + maxLag);
        }
        int n = values.length;
        if (n == 0) {
            return new double[0];
        }
        double mean = Stats.mean(values);
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0) {
            return new double[0];
        }

        int lags = Math.min(maxLag, n - 1);
        double[] acf = new double[lags + 1];
        for (int k = 0; k <= lags; k++) {
            double sum = 0;
            for (int t = 0; t < n - k; t++) {
                sum += (values[t] - mean) * (values[t + k] - mean);
            }
            acf[k] = sum / denominator;
        }
        return acf;
    }
}
