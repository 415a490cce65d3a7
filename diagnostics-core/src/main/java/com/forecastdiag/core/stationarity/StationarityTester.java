package com.forecastdiag.core.stationarity;

import com.forecastdiag.core.model.NumericSeries;
import com.forecastdiag.core.model.StationarityVerdict;
import com.forecastdiag.core.util.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs the ADF and KPSS stationarity tests and merges their verdicts.
 *
 * <p>
 * The merge is conservative: a series is reported stationary only when ADF
 * rejects its unit-root null ({@code p < 0.05}) <em>and</em> KPSS fails to
 * reject its stationarity null ({@code p > 0.05}). Disagreement yields
 * {@code false}.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <p>
 * A constant series, or one whose first differences are all equal, leaves
 * the ADF regression without variance. Such a series is reported with
 * {@link StationarityVerdict#undefined()} values rather than an exception.
 * </p>
 *
 * <p>
 * Non-finite values are dropped before testing.
 * </p>
 *
 * @since 1.0.0
 */
public class StationarityTester {

    private static final Logger LOG = LoggerFactory.getLogger(StationarityTester.class);

    /** Differences closer than this, relative to the series scale, count as equal. */
    private static final double RELATIVE_TOLERANCE = 1e-12;

    public StationarityVerdict test(NumericSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        return test(series.values());
    }

    /**
     * @param values series values
     * @return the combined verdict
     * @throws IllegalArgumentException if fewer than four finite values remain
     */
    public StationarityVerdict test(double[] values) {
        Stats.requireNonEmpty(values, "values");
        double[] x = Stats.finite(values);
        if (x.length < AdfTest.MIN_OBSERVATIONS) {
            throw new IllegalArgumentException("Stationarity testing needs at least "
                    + AdfTest.MIN_OBSERVATIONS + " finite values, got: " + x.length);
        }

        if (hasConstantDifferences(x)) {
            LOG.debug("Series of {} value(s) is constant or linear; stationarity is undefined", x.length);
            return StationarityVerdict.undefined();
        }

        AdfTest.Result adf = AdfTest.run(x);
        KpssTest.Result kpss = KpssTest.run(x);
        StationarityVerdict verdict = new StationarityVerdict(
                adf.statistic(), adf.pValue(), adf.usedLag(),
                kpss.statistic(), kpss.pValue(), kpss.lags());

        if (verdict.isAdfStationary() != verdict.isKpssStationary()) {
            LOG.debug("ADF and KPSS disagree (adf p={}, kpss p={}); reporting non-stationary",
                    verdict.getAdfPValue(), verdict.getKpssPValue());
        }
        return verdict;
    }

    private static boolean hasConstantDifferences(double[] x) {
        // relative to the data so that series of tiny magnitude still count
        double scale = 0.0;
        for (double v : x) {
            scale = Math.max(scale, Math.abs(v));
        }
        double tolerance = RELATIVE_TOLERANCE * scale;
        double first = x[1] - x[0];
        for (int i = 2; i < x.length; i++) {
            if (Math.abs(x[i] - x[i - 1] - first) > tolerance) {
                return false;
            }
        }
        return true;
    }
}
