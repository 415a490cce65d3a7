package com.forecastdiag.core.accuracy;

import com.forecastdiag.core.model.ActualForecastPair;
import com.forecastdiag.core.model.BiasReport;
import com.forecastdiag.core.model.BiasReport.Direction;
import com.forecastdiag.core.util.Stats;
import org.apache.commons.math3.stat.inference.TTest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Diagnoses systematic over- or under-forecasting.
 *
 * <p>
 * Besides the plain mean bias, the analyzer reports the median and
 * actual-weighted bias and runs a one-sample t-test of the errors against
 * zero. Errors with zero spread cannot be tested: the t statistic and p-value
 * are then {@link Double#NaN} and the bias is not reported as systematic.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastBiasAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastBiasAnalyzer.class);

    public BiasReport analyze(ActualForecastPair pair) {
        Objects.requireNonNull(pair, "ActualForecastPair must not be null");
        return analyze(pair.actual().values(), pair.forecast().values());
    }

    /**
     * @param actual   observed values
     * @param forecast forecast values
     * @return bias diagnostics
     * @throws IllegalArgumentException if the arrays are empty or differ in
     *                                  length
     */
    public BiasReport analyze(double[] actual, double[] forecast) {
        int n = AccuracyMetricsEngine.checkAligned(actual, forecast);

        double[] errors = new double[n];
        double sumAbsActual = 0;
        double sumPct = 0;
        double sumAbsPct = 0;
        int pctCount = 0;
        for (int i = 0; i < n; i++) {
            errors[i] = forecast[i] - actual[i];
            sumAbsActual += Math.abs(actual[i]);
            if (actual[i] != 0) {
                double pct = errors[i] / actual[i] * 100.0;
                sumPct += pct;
                sumAbsPct += Math.abs(pct);
                pctCount++;
            }
        }

        double weightedBias = Double.NaN;
        if (sumAbsActual != 0) {
            weightedBias = 0;
            for (int i = 0; i < n; i++) {
                weightedBias += Math.abs(actual[i]) / sumAbsActual * errors[i];
            }
        }

        double meanBias = Stats.mean(errors);
        double[] test = oneSampleTTest(errors);

        BiasReport report = BiasReport.builder()
                .meanBias(meanBias)
                .medianBias(Stats.median(errors))
                .meanAbsoluteError(meanAbsolute(errors))
                .meanPercentageError(pctCount > 0 ? sumPct / pctCount : Double.NaN)
                .meanAbsolutePercentageError(pctCount > 0 ? sumAbsPct / pctCount : Double.NaN)
                .weightedBias(weightedBias)
                .direction(meanBias > 0 ? Direction.OVER : meanBias < 0 ? Direction.UNDER : Direction.NEUTRAL)
                .biasConsistency(Stats.populationStd(errors))
                .tStatistic(test[0])
                .pValue(test[1])
                .sampleSize(n)
                .build();

        LOG.debug("Bias analysis over {} point(s): {}", n, report);
        return report;
    }

    /**
     * Two-sided one-sample t-test of {@code mu = 0}.
     *
     * @return {@code {t, p}}; both NaN when fewer than two errors or zero spread
     */
    private static double[] oneSampleTTest(double[] errors) {
        int n = errors.length;
        if (n < 2) {
            return new double[] { Double.NaN, Double.NaN };
        }
        double sd = Stats.sampleStd(errors);
        if (sd == 0) {
            LOG.debug("Forecast errors have zero spread; bias t-test is undefined");
            return new double[] { Double.NaN, Double.NaN };
        }
        TTest tTest = new TTest();
        return new double[] { tTest.t(0.0, errors), tTest.tTest(0.0, errors) };
    }

    private static double meanAbsolute(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += Math.abs(v);
        }
        return sum / values.length;
    }
}
