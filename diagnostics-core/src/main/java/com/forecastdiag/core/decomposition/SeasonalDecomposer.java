package com.forecastdiag.core.decomposition;

import com.forecastdiag.core.model.DecompositionMode;
import com.forecastdiag.core.model.DecompositionResult;
import com.forecastdiag.core.model.NumericSeries;
import com.forecastdiag.core.util.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Classical moving-average seasonal decomposition.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Trend: centred moving average over one period (a 2 × period average
 * for even periods). The first and last {@code period / 2} positions have no
 * full window and are {@link Double#NaN}.</li>
 * <li>Detrend: {@code observed - trend} (additive) or
 * {@code observed / trend} (multiplicative).</li>
 * <li>Seasonal: mean of the detrended values at each phase of the period,
 * centred to mean 0 (additive) or 1 (multiplicative), repeated over the
 * whole series.</li>
 * <li>Residual: {@code detrended - seasonal} or
 * {@code detrended / seasonal}.</li>
 * </ol>
 *
 * <p>
 * When no period is given it is estimated with the
 * {@link PeriodicityEstimator}. At least two complete periods are required.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposer.class);

    private final PeriodicityEstimator periodicityEstimator;

    public SeasonalDecomposer() {
        this(new PeriodicityEstimator());
    }

    public SeasonalDecomposer(PeriodicityEstimator periodicityEstimator) {
        this.periodicityEstimator = Objects.requireNonNull(periodicityEstimator,
                "PeriodicityEstimator must not be null");
    }

    public DecompositionResult decompose(NumericSeries series, DecompositionMode mode, Integer period) {
        Objects.requireNonNull(series, "series must not be null");
        return decompose(series.values(), mode, period);
    }

    public DecompositionResult decompose(double[] values, DecompositionMode mode) {
        return decompose(values, mode, null);
    }

    /**
     * Decompose a regularly indexed series.
     *
     * @param values series values, all finite
     * @param mode   additive or multiplicative
     * @param period seasonal period, or {@code null} to estimate it
     * @return components and strength diagnostics
     * @throws IllegalArgumentException if the period is below 1, the series is
     *                                  shorter than two periods, a value is not
     *                                  finite, or a multiplicative
     *                                  decomposition meets a non-positive value
     */
    public DecompositionResult decompose(double[] values, DecompositionMode mode, Integer period) {
        Stats.requireNonEmpty(values, "values");
        Objects.requireNonNull(mode, "mode must not be null");
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Value at index " + i + " is not finite: " + values[i]);
            }
            if (mode == DecompositionMode.MULTIPLICATIVE && values[i] <= 0) {
                throw new IllegalArgumentException(
                        "Multiplicative decomposition requires strictly positive values, got "
                                + values[i] + " at index " + i);
            }
        }

        int p = period != null ? period : periodicityEstimator.estimate(values);
        if (p < 1) {
            throw new IllegalArgumentException("Period must be >= 1, got: " + p);
        }
        int n = values.length;
        if (n < 2 * p) {
            throw new IllegalArgumentException("Decomposition with period " + p + " needs at least "
                    + (2 * p) + " observations, got: " + n);
        }

        boolean additive = mode == DecompositionMode.ADDITIVE;
        double[] trend = centredMovingAverage(values, p);
        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = additive ? values[i] - trend[i] : values[i] / trend[i];
        }

        double[] pattern = seasonalPattern(detrended, p, additive);
        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = pattern[i % p];
            residual[i] = additive ? detrended[i] - seasonal[i] : detrended[i] / seasonal[i];
        }

        DecompositionResult result = DecompositionResult.builder()
                .mode(mode)
                .period(p)
                .observed(values)
                .trend(trend)
                .seasonal(seasonal)
                .residual(residual)
                .trendStrength(trendStrength(trend, residual))
                .seasonalStrength(seasonalStrength(seasonal, residual))
                .noiseRatio(noiseRatio(values, residual))
                .build();
        LOG.debug("Decomposed {} point(s): {}", n, result);
        return result;
    }

    // ---------------------------------------------------------------
    // Strength measures
    // ---------------------------------------------------------------

    /**
     * {@code 1 - Var(residual) / (Var(seasonal) + Var(residual))}, each variance
     * over the finite entries of its own component, clamped to [0, 1]. Zero
     * when both variances are zero.
     */
    public static double seasonalStrength(double[] seasonal, double[] residual) {
        double varSeasonal = Stats.finiteVariance(seasonal);
        double varResidual = Stats.finiteVariance(residual);
        if (Double.isNaN(varSeasonal) || Double.isNaN(varResidual)) {
            return 0.0;
        }
        double total = varSeasonal + varResidual;
        if (total == 0) {
            return 0.0;
        }
        return clamp(1 - varResidual / total);
    }

    /**
     * {@code 1 - Var(residual) / Var(trend + residual)} over positions where
     * both components are finite, clamped to [0, 1]. Zero when the
     * denominator is zero.
     */
    public static double trendStrength(double[] trend, double[] residual) {
        int n = Math.min(trend.length, residual.length);
        double[] sum = new double[n];
        for (int i = 0; i < n; i++) {
            sum[i] = trend[i] + residual[i];
        }
        double varSum = Stats.finiteVariance(sum);
        double varResidual = Stats.finiteVariance(residual);
        if (Double.isNaN(varSum) || Double.isNaN(varResidual) || varSum == 0) {
            return 0.0;
        }
        return clamp(1 - varResidual / varSum);
    }

    /**
     * Residual variance as a share of the observed variance, both over the
     * positions where the residual is finite, clamped to [0, 1].
     */
    static double noiseRatio(double[] observed, double[] residual) {
        int count = 0;
        for (double r : residual) {
            if (Double.isFinite(r)) {
                count++;
            }
        }
        if (count == 0) {
            return 0.0;
        }
        double[] obs = new double[count];
        double[] res = new double[count];
        int j = 0;
        for (int i = 0; i < residual.length; i++) {
            if (Double.isFinite(residual[i])) {
                obs[j] = observed[i];
                res[j] = residual[i];
                j++;
            }
        }
        double varObserved = Stats.populationVariance(obs);
        if (varObserved == 0) {
            return 0.0;
        }
        return clamp(Stats.populationVariance(res) / varObserved);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Two-sided moving average. Odd periods use {@code period} equal weights;
     * even periods use {@code period + 1} weights with half weight at both
     * ends.
     */
    static double[] centredMovingAverage(double[] values, int period) {
        int n = values.length;
        double[] trend = new double[n];
        Arrays.fill(trend, Double.NaN);
        if (period == 1) {
            return values.clone();
        }

        int half = period / 2;
        boolean even = period % 2 == 0;
        for (int i = half; i < n - half; i++) {
            double sum = 0;
            for (int k = -half; k <= half; k++) {
                double weight = even && Math.abs(k) == half ? 0.5 : 1.0;
                sum += weight * values[i + k];
            }
            trend[i] = sum / period;
        }
        return trend;
    }

    /**
     * Per-phase means of the detrended series, normalised so that they average
     * to 0 (additive) or 1 (multiplicative).
     */
    static double[] seasonalPattern(double[] detrended, int period, boolean additive) {
        double[] pattern = new double[period];
        for (int phase = 0; phase < period; phase++) {
            double sum = 0;
            int count = 0;
            for (int i = phase; i < detrended.length; i += period) {
                if (Double.isFinite(detrended[i])) {
                    sum += detrended[i];
                    count++;
                }
            }
            pattern[phase] = count > 0 ? sum / count : Double.NaN;
        }

        double centre = Stats.mean(pattern);
        for (int phase = 0; phase < period; phase++) {
            pattern[phase] = additive ? pattern[phase] - centre : pattern[phase] / centre;
        }
        return pattern;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
