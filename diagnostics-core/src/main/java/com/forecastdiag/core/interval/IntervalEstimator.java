package com.forecastdiag.core.interval;

import com.forecastdiag.core.model.Interval;
import com.forecastdiag.core.model.NumericSeries;
import com.forecastdiag.core.util.Stats;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Confidence and prediction intervals.
 *
 * <h3>Capabilities</h3>
 * <ul>
 * <li>{@link #frequentist(double[], double)}: t-based interval for the
 * mean</li>
 * <li>{@link #bootstrap(double[], double, int)}: percentile bootstrap interval
 * for the mean</li>
 * <li>{@link #prediction(double, double, double, Integer)}: interval around a
 * single point forecast</li>
 * <li>{@link #forecastIntervals(double[], double[], List)}: prediction bands
 * for many forecasts at several levels</li>
 * </ul>
 *
 * <h3>Randomness</h3>
 * <p>
 * Only the bootstrap draws random numbers, from the {@link RandomGenerator}
 * given at construction. Two estimators built with generators seeded alike
 * return identical bootstrap intervals for the same input. The generator is
 * not thread-safe, so an estimator used for bootstrapping must not be shared
 * across threads.
 * </p>
 *
 * @since 1.0.0
 */
public class IntervalEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(IntervalEstimator.class);

    /** Default number of bootstrap resamples. */
    public static final int DEFAULT_BOOTSTRAP_ITERATIONS = 1000;

    /** Default confidence levels for {@link #forecastIntervals(double[], double[])}. */
    public static final List<Double> DEFAULT_LEVELS = List.of(0.5, 0.8, 0.95);

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private final RandomGenerator random;

    /**
     * Create an estimator with an unseeded generator.
     */
    public IntervalEstimator() {
        this(new Well19937c());
    }

    /**
     * @param random source of randomness for bootstrap resampling; must not be
     *               {@code null}
     */
    public IntervalEstimator(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "RandomGenerator must not be null");
    }

    // ---------------------------------------------------------------
    // Confidence intervals for the mean
    // ---------------------------------------------------------------

    public Interval frequentist(NumericSeries series, double level) {
        Objects.requireNonNull(series, "series must not be null");
        return frequentist(series.values(), level);
    }

    /**
     * {@code mean ± t((1 + level) / 2, n - 1) × sem}, with the standard error
     * taken from the sample standard deviation.
     *
     * @param data  observations, at least two
     * @param level confidence level in (0, 1)
     * @return interval for the mean
     * @throws IllegalArgumentException if fewer than two observations are given
     *                                  or the level is invalid
     */
    public Interval frequentist(double[] data, double level) {
        Stats.requireNonEmpty(data, "data");
        Stats.requireLevel(level);
        int n = data.length;
        if (n < 2) {
            throw new IllegalArgumentException("Frequentist interval needs at least 2 observations, got: " + n);
        }
        double mean = Stats.mean(data);
        double sem = Stats.sampleStd(data) / Math.sqrt(n);
        double margin = tQuantile((1 + level) / 2, n - 1) * sem;
        return new Interval(mean - margin, mean + margin, level);
    }

    public Interval bootstrap(NumericSeries series, double level, int iterations) {
        Objects.requireNonNull(series, "series must not be null");
        return bootstrap(series.values(), level, iterations);
    }

    public Interval bootstrap(double[] data, double level) {
        return bootstrap(data, level, DEFAULT_BOOTSTRAP_ITERATIONS);
    }

    /**
     * Percentile bootstrap for the mean.
     *
     * <p>
     * Draws {@code iterations} resamples of size {@code n} with replacement,
     * records each resample mean and returns the {@code α/2} and
     * {@code 1 - α/2} percentiles of those means, {@code α = 1 - level}.
     * </p>
     *
     * @param data       observations
     * @param level      confidence level in (0, 1)
     * @param iterations number of resamples, {@code >= 1}
     * @return interval for the mean
     */
    public Interval bootstrap(double[] data, double level, int iterations) {
        Stats.requireNonEmpty(data, "data");
        Stats.requireLevel(level);
        if (iterations < 1) {
            throw new IllegalArgumentException("Bootstrap iterations must be >= 1, got: " + iterations);
        }
        int n = data.length;
        double[] means = new double[iterations];
        for (int b = 0; b < iterations; b++) {
            double sum = 0;
            for (int i = 0; i < n; i++) {
                sum += data[random.nextInt(n)];
            }
            means[b] = sum / n;
        }

        double alpha = 1 - level;
        double lower = Stats.percentile(means, alpha / 2 * 100);
        double upper = Stats.percentile(means, (1 - alpha / 2) * 100);
        LOG.trace("Bootstrap interval at level {} from {} resample(s): [{}, {}]", level, iterations, lower, upper);
        return new Interval(lower, upper, level);
    }

    // ---------------------------------------------------------------
    // Prediction intervals
    // ---------------------------------------------------------------

    /**
     * Interval around a point forecast.
     *
     * @param forecast         point forecast
     * @param standardError    standard error of the forecast
     * @param level            confidence level in (0, 1)
     * @param degreesOfFreedom {@code null} for a normal quantile, otherwise the
     *                         t-distribution degrees of freedom ({@code >= 1})
     * @return {@code forecast ± quantile × standardError}
     * @throws IllegalArgumentException if the level or the degrees of freedom
     *                                  are invalid
     */
    public Interval prediction(double forecast, double standardError, double level, Integer degreesOfFreedom) {
        Stats.requireLevel(level);
        double p = (1 + level) / 2;
        double quantile;
        if (degreesOfFreedom == null) {
            quantile = STANDARD_NORMAL.inverseCumulativeProbability(p);
        } else {
            if (degreesOfFreedom < 1) {
                throw new IllegalArgumentException("Degrees of freedom must be >= 1, got: " + degreesOfFreedom);
            }
            quantile = tQuantile(p, degreesOfFreedom);
        }
        double margin = quantile * standardError;
        return new Interval(forecast - margin, forecast + margin, level);
    }

    public Interval prediction(double forecast, double standardError, double level) {
        return prediction(forecast, standardError, level, null);
    }

    public Map<Double, List<Interval>> forecastIntervals(double[] pointForecasts, double[] residuals) {
        return forecastIntervals(pointForecasts, residuals, DEFAULT_LEVELS);
    }

    /**
     * Normal prediction bands for several forecasts at several levels.
     *
     * <p>
     * The standard error is the population standard deviation of
     * {@code residuals}. The returned map iterates in the order of
     * {@code levels}; each value holds one interval per point forecast.
     * </p>
     *
     * @param pointForecasts forecasts to wrap
     * @param residuals      historical forecast residuals
     * @param levels         confidence levels, each in (0, 1)
     * @return unmodifiable map from level to intervals
     */
    public Map<Double, List<Interval>> forecastIntervals(double[] pointForecasts, double[] residuals,
            List<Double> levels) {
        Stats.requireNonEmpty(pointForecasts, "pointForecasts");
        Stats.requireNonEmpty(residuals, "residuals");
        Objects.requireNonNull(levels, "levels must not be null");
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("levels must not be empty");
        }

        double standardError = Stats.populationStd(residuals);
        Map<Double, List<Interval>> bands = new LinkedHashMap<>();
        for (Double level : levels) {
            Objects.requireNonNull(level, "level must not be null");
            List<Interval> intervals = new ArrayList<>(pointForecasts.length);
            for (double forecast : pointForecasts) {
                intervals.add(prediction(forecast, standardError, level, null));
            }
            bands.put(level, Collections.unmodifiableList(intervals));
        }
        LOG.debug("Built prediction bands for {} forecast(s) at {} level(s), stdError={}",
                pointForecasts.length, levels.size(), standardError);
        return Collections.unmodifiableMap(bands);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double tQuantile(double p, int degreesOfFreedom) {
        return new TDistribution(degreesOfFreedom).inverseCumulativeProbability(p);
    }
}
