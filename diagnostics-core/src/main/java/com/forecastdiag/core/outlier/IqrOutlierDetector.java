package com.forecastdiag.core.outlier;

import com.forecastdiag.core.util.Stats;

/**
 * Interquartile-range (Tukey fence) outlier detector.
 *
 * <p>
 * Flags points outside {@code [Q1 - k·IQR, Q3 + k·IQR]}, quartiles being
 * linearly interpolated. For constant input the fences collapse onto the
 * common value and nothing is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrOutlierDetector implements OutlierDetector {

    public static final String METHOD = "iqr";
    public static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public IqrOutlierDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    /**
     * @param multiplier fence multiplier {@code k}; must be {@code >= 0}
     */
    public IqrOutlierDetector(double multiplier) {
        if (!(multiplier >= 0)) {
            throw new IllegalArgumentException("IQR multiplier must be >= 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public boolean[] detect(double[] values) {
        Stats.requireNonEmpty(values, "values");
        double q1 = Stats.percentile(values, 25);
        double q3 = Stats.percentile(values, 75);
        double iqr = q3 - q1;
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;

        boolean[] flags = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            flags[i] = values[i] < lower || values[i] > upper;
        }
        return flags;
    }

    @Override
    public String getMethodName() {
        return METHOD;
    }

    @Override
    public double getParameter() {
        return multiplier;
    }
}
