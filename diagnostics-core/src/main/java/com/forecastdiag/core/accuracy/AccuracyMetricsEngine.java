package com.forecastdiag.core.accuracy;

import com.forecastdiag.core.model.AccuracyMetricSet;
import com.forecastdiag.core.model.ActualForecastPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Point-forecast error metrics.
 *
 * <p>
 * Every method takes index-aligned {@code actual} and {@code forecast}
 * arrays of the same non-zero length. Percentage metrics are in percent and
 * return {@link Double#NaN} instead of dividing by zero:
 * </p>
 * <ul>
 * <li>MAPE uses only positions where {@code actual != 0}</li>
 * <li>WAPE is undefined when {@code sum(|actual|) == 0}</li>
 * <li>SMAPE uses only positions where {@code |actual| + |forecast| != 0}</li>
 * </ul>
 *
 * <p>
 * The engine is stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class AccuracyMetricsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AccuracyMetricsEngine.class);

    /**
     * Compute all seven metrics in one pass.
     *
     * @param pair validated actual/forecast pair
     * @return the full metric set
     */
    public AccuracyMetricSet computeAll(ActualForecastPair pair) {
        Objects.requireNonNull(pair, "ActualForecastPair must not be null");
        return computeAll(pair.actual().values(), pair.forecast().values());
    }

    /**
     * Compute all seven metrics in one pass.
     *
     * @param actual   observed values
     * @param forecast forecast values
     * @return the full metric set
     * @throws IllegalArgumentException if the arrays are empty or differ in
     *                                  length
     */
    public AccuracyMetricSet computeAll(double[] actual, double[] forecast) {
        int n = checkAligned(actual, forecast);

        double sumAbs = 0;
        double sumSq = 0;
        double sumSigned = 0;
        double sumAbsActual = 0;
        double sumPct = 0;
        int pctCount = 0;
        double sumSym = 0;
        int symCount = 0;

        for (int i = 0; i < n; i++) {
            double a = actual[i];
            double f = forecast[i];
            double absErr = Math.abs(a - f);

            sumAbs += absErr;
            sumSq += (a - f) * (a - f);
            sumSigned += f - a;
            sumAbsActual += Math.abs(a);

            if (a != 0) {
                sumPct += absErr / Math.abs(a);
                pctCount++;
            }
            double denominator = (Math.abs(a) + Math.abs(f)) / 2.0;
            if (denominator != 0) {
                sumSym += absErr / denominator;
                symCount++;
            }
        }

        double mse = sumSq / n;
        AccuracyMetricSet metrics = new AccuracyMetricSet(
                pctCount > 0 ? sumPct / pctCount * 100.0 : Double.NaN,
                sumAbsActual != 0 ? sumAbs / sumAbsActual * 100.0 : Double.NaN,
                sumAbs / n,
                Math.sqrt(mse),
                sumSigned / n,
                symCount > 0 ? sumSym / symCount * 100.0 : Double.NaN,
                mse);

        LOG.trace("Computed accuracy metrics over {} point(s): {}", n, metrics);
        return metrics;
    }

    // ---------------------------------------------------------------
    // Individual metrics
    // ---------------------------------------------------------------

    public double mape(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getMape();
    }

    public double wape(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getWape();
    }

    public double mae(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getMae();
    }

    public double rmse(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getRmse();
    }

    /**
     * @return {@code mean(forecast - actual)}; positive means over-forecasting
     */
    public double bias(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getBias();
    }

    public double smape(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getSmape();
    }

    public double mse(double[] actual, double[] forecast) {
        return computeAll(actual, forecast).getMse();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static int checkAligned(double[] actual, double[] forecast) {
        Objects.requireNonNull(actual, "actual must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");
        if (actual.length != forecast.length) {
            throw new IllegalArgumentException("actual and forecast must have the same length, got "
                    + actual.length + " and " + forecast.length);
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("actual and forecast must not be empty");
        }
        return actual.length;
    }
}
