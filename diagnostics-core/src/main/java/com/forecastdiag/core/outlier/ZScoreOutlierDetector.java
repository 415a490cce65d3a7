package com.forecastdiag.core.outlier;

import com.forecastdiag.core.util.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Z-score outlier detector.
 *
 * <p>
 * A point is an outlier when {@code |(x - mean) / σ|} exceeds the threshold,
 * σ being the population standard deviation. A sample with σ = 0 has no
 * outliers.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreOutlierDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreOutlierDetector.class);

    public static final String METHOD = "zscore";
    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public ZScoreOutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold absolute z-score above which a point is flagged; must be
     *                  {@code > 0}
     */
    public ZScoreOutlierDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean[] detect(double[] values) {
        Stats.requireNonEmpty(values, "values");
        boolean[] flags = new boolean[values.length];

        double mean = Stats.mean(values);
        double std = Stats.populationStd(values);
        if (std == 0) {
            LOG.trace("Zero standard deviation over {} value(s); no z-score outliers", values.length);
            return flags;
        }

        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs((values[i] - mean) / std) > threshold;
        }
        return flags;
    }

    @Override
    public String getMethodName() {
        return METHOD;
    }

    @Override
    public double getParameter() {
        return threshold;
    }
}
