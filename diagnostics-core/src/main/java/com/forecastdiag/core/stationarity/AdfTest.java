package com.forecastdiag.core.stationarity;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Augmented Dickey-Fuller unit-root test with a constant.
 *
 * <p>
 * Regresses {@code Δx[t]} on a constant, {@code x[t]} and
 * {@code Δx[t-1] .. Δx[t-p]}. The lag order {@code p} is chosen by minimum
 * AIC over {@code 0 .. maxlag} on a common sample, then the regression is
 * refitted on all usable observations. The statistic is the t-value of the
 * {@code x[t]} coefficient; the null hypothesis is a unit root.
 * </p>
 *
 * <p>
 * {@code maxlag = ceil(12 · (n / 100)^¼)}, capped at {@code n / 2 - 2}.
 * </p>
 */
final class AdfTest {

    private static final Logger LOG = LoggerFactory.getLogger(AdfTest.class);

    /** Smallest series the test accepts. */
    static final int MIN_OBSERVATIONS = 4;

    /**
     * τ statistic (NaN when the regression is degenerate), MacKinnon p-value
     * and the number of lagged differences in the final regression.
     */
    static final class Result {
        private final double statistic;
        private final double pValue;
        private final int usedLag;

        Result(double statistic, double pValue, int usedLag) {
            this.statistic = statistic;
            this.pValue = pValue;
            this.usedLag = usedLag;
        }

        double statistic() {
            return statistic;
        }

        double pValue() {
            return pValue;
        }

        int usedLag() {
            return usedLag;
        }
    }

    private AdfTest() {
        // utility class, not instantiable
    }

    static int maxLag(int n) {
        int schwert = (int) Math.ceil(12.0 * Math.pow(n / 100.0, 0.25));
        return Math.min(n / 2 - 2, schwert);
    }

    /**
     * @param x series values, at least {@value #MIN_OBSERVATIONS}
     * @return test result
     * @throws IllegalArgumentException if the series is too short
     */
    static Result run(double[] x) {
        int n = x.length;
        int maxLag = maxLag(n);
        if (n < MIN_OBSERVATIONS || maxLag < 0) {
            throw new IllegalArgumentException("ADF test needs at least " + MIN_OBSERVATIONS
                    + " observations, got: " + n);
        }

        double[] diff = new double[n - 1];
        for (int i = 1; i < n; i++) {
            diff[i - 1] = x[i] - x[i - 1];
        }

        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            double aic = aic(x, diff, lag, maxLag);
            // strict comparison keeps the smallest lag on ties
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        LOG.trace("ADF lag selection: maxlag={}, chosen={}, aic={}", maxLag, bestLag, bestAic);

        OLSMultipleLinearRegression ols = fit(x, diff, bestLag, bestLag);
        if (ols == null) {
            return new Result(Double.NaN, Double.NaN, bestLag);
        }
        double statistic;
        try {
            // parameter 0 is the intercept, 1 the lagged level
            double beta = ols.estimateRegressionParameters()[1];
            double se = ols.estimateRegressionParametersStandardErrors()[1];
            statistic = beta / se;
        } catch (SingularMatrixException e) {
            LOG.debug("ADF regression covariance is singular; statistic undefined");
            statistic = Double.NaN;
        }
        return new Result(statistic, MacKinnonPValue.pValue(statistic), bestLag);
    }

    private static double aic(double[] x, double[] diff, int lag, int sampleLag) {
        OLSMultipleLinearRegression ols = fit(x, diff, lag, sampleLag);
        if (ols == null) {
            return Double.POSITIVE_INFINITY;
        }
        int nobs = diff.length - sampleLag;
        int k = lag + 2;
        double ssr = ols.calculateResidualSumOfSquares();
        double llf = -nobs / 2.0 * (Math.log(2 * Math.PI) + Math.log(ssr / nobs) + 1);
        return -2 * llf + 2 * k;
    }

    /**
     * Fit {@code Δx[t] = c + γ·x[t] + Σ δᵢ·Δx[t-i]} for {@code i = 1..lag},
     * using only rows with {@code t >= sampleLag}.
     *
     * @return the fitted regression, or {@code null} if the design is singular
     */
    private static OLSMultipleLinearRegression fit(double[] x, double[] diff, int lag, int sampleLag) {
        int nobs = diff.length - sampleLag;
        double[] y = new double[nobs];
        double[][] design = new double[nobs][lag + 1];
        for (int r = 0; r < nobs; r++) {
            int t = r + sampleLag;
            y[r] = diff[t];
            design[r][0] = x[t];
            for (int i = 1; i <= lag; i++) {
                design[r][i] = diff[t - i];
            }
        }
        if (nobs <= lag + 2) {
            return null;
        }
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        try {
            ols.newSampleData(y, design);
            // forces the QR decomposition so singularity surfaces here
            ols.estimateRegressionParameters();
            return ols;
        } catch (SingularMatrixException e) {
            LOG.debug("ADF regression with {} lag(s) is singular", lag);
            return null;
        }
    }
}
