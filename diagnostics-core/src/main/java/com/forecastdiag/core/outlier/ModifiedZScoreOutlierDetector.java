package com.forecastdiag.core.outlier;

import com.forecastdiag.core.util.Stats;

/**
 * Median-based (Iglewicz-Hoaglin) outlier detector.
 *
 * <p>
 * Uses {@code 0.6745 · (x - median) / MAD}, MAD being the median absolute
 * deviation. Less sensitive than the plain z-score to the outliers it is
 * looking for. A sample with MAD = 0 has no outliers.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreOutlierDetector implements OutlierDetector {

    public static final String METHOD = "modified_zscore";
    public static final double DEFAULT_THRESHOLD = 3.5;

    /** Scales the MAD to the standard deviation of a normal distribution. */
    static final double MAD_SCALE = 0.6745;

    private final double threshold;

    public ModifiedZScoreOutlierDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ModifiedZScoreOutlierDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Modified z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public boolean[] detect(double[] values) {
        Stats.requireNonEmpty(values, "values");
        boolean[] flags = new boolean[values.length];

        double median = Stats.median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = Stats.median(deviations);
        if (mad == 0) {
            return flags;
        }

        for (int i = 0; i < values.length; i++) {
            flags[i] = Math.abs(MAD_SCALE * (values[i] - median) / mad) > threshold;
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
