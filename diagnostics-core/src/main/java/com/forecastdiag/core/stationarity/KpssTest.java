package com.forecastdiag.core.stationarity;

import com.forecastdiag.core.util.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KPSS test for level stationarity.
 *
 * <p>
 * The statistic is {@code Σ S[t]² / (n² · σ̂²)}, {@code S} being the partial
 * sums of the demeaned series and {@code σ̂²} the Bartlett-weighted long-run
 * variance. The bandwidth follows Hobijn, Franses and Ooms (1998). The null
 * hypothesis is stationarity.
 * </p>
 *
 * <p>
 * P-values are interpolated from the published critical values and are
 * therefore confined to {@code [0.01, 0.10]}.
 * </p>
 */
final class KpssTest {

    private static final Logger LOG = LoggerFactory.getLogger(KpssTest.class);

    private static final double[] CRITICAL_VALUES = { 0.347, 0.463, 0.574, 0.739 };
    private static final double[] P_VALUES = { 0.10, 0.05, 0.025, 0.01 };

    /** Statistic, interpolated p-value and the Bartlett bandwidth used. */
    static final class Result {
        private final double statistic;
        private final double pValue;
        private final int lags;

        Result(double statistic, double pValue, int lags) {
            this.statistic = statistic;
            this.pValue = pValue;
            this.lags = lags;
        }

        double statistic() {
            return statistic;
        }

        double pValue() {
            return pValue;
        }

        int lags() {
            return lags;
        }
    }

    private KpssTest() {
        // utility class, not instantiable
    }

    /**
     * @param x non-constant series values, at least two
     * @return test result
     */
    static Result run(double[] x) {
        int n = x.length;
        double mean = Stats.mean(x);
        double[] resid = new double[n];
        for (int i = 0; i < n; i++) {
            resid[i] = x[i] - mean;
        }

        int lags = Math.min(autoLag(resid), n - 1);

        double partial = 0;
        double eta = 0;
        for (double r : resid) {
            partial += r;
            eta += partial * partial;
        }
        eta /= (double) n * n;

        double statistic = eta / longRunVariance(resid, lags);
        return new Result(statistic, pValue(statistic), lags);
    }

    static double pValue(double statistic) {
        if (statistic <= CRITICAL_VALUES[0]) {
            if (statistic < CRITICAL_VALUES[0]) {
                LOG.debug("KPSS statistic {} is below the table; actual p-value is greater than {}",
                        statistic, P_VALUES[0]);
            }
            return P_VALUES[0];
        }
        int last = CRITICAL_VALUES.length - 1;
        if (statistic >= CRITICAL_VALUES[last]) {
            if (statistic > CRITICAL_VALUES[last]) {
                LOG.debug("KPSS statistic {} is above the table; actual p-value is smaller than {}",
                        statistic, P_VALUES[last]);
            }
            return P_VALUES[last];
        }
        for (int i = 1; i <= last; i++) {
            if (statistic <= CRITICAL_VALUES[i]) {
                double fraction = (statistic - CRITICAL_VALUES[i - 1])
                        / (CRITICAL_VALUES[i] - CRITICAL_VALUES[i - 1]);
                return P_VALUES[i - 1] + fraction * (P_VALUES[i] - P_VALUES[i - 1]);
            }
        }
        return P_VALUES[last];
    }

    /**
     * Hobijn et al. data-dependent bandwidth.
     */
    static int autoLag(double[] resid) {
        int n = resid.length;
        int covLags = (int) Math.pow(n, 2.0 / 9.0);
        double s0 = 0;
        for (double r : resid) {
            s0 += r * r;
        }
        s0 /= n;
        double s1 = 0;
        for (int i = 1; i <= covLags; i++) {
            double product = lagProduct(resid, i) / (n / 2.0);
            s0 += product;
            s1 += i * product;
        }
        double sHat = s1 / s0;
        double gammaHat = 1.1447 * Math.pow(sHat * sHat, 1.0 / 3.0);
        return (int) (gammaHat * Math.pow(n, 1.0 / 3.0));
    }

    private static double longRunVariance(double[] resid, int lags) {
        int n = resid.length;
        double sHat = 0;
        for (double r : resid) {
            sHat += r * r;
        }
        for (int i = 1; i <= lags; i++) {
            sHat += 2 * lagProduct(resid, i) * (1.0 - i / (lags + 1.0));
        }
        return sHat / n;
    }

    private static double lagProduct(double[] resid, int lag) {
        double sum = 0;
        for (int t = lag; t < resid.length; t++) {
            sum += resid[t] * resid[t - lag];
        }
        return sum;
    }
}
