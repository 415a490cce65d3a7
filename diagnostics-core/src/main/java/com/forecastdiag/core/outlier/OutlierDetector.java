package com.forecastdiag.core.outlier;

import com.forecastdiag.core.model.OutlierReport;

/**
 * Contract for all outlier detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: the tuning parameter is
 * fixed at construction and every call to {@link #detect(double[])} looks
 * only at its argument. A single instance may be shared across threads.
 * </p>
 * <p>
 * Constant input never raises; a detector whose spread measure is zero
 * reports no outliers.
 * </p>
 */
public interface OutlierDetector {

    /**
     * Flag the outlying points of a univariate sample.
     *
     * @param values the sample; must not be empty
     * @return one flag per input point, {@code true} for an outlier
     * @throws IllegalArgumentException if {@code values} is empty
     */
    boolean[] detect(double[] values);

    /**
     * Return the method name used in reports and configuration.
     *
     * @return method name
     */
    String getMethodName();

    /**
     * Return the tuning parameter (threshold, multiplier or contamination).
     *
     * @return parameter value
     */
    double getParameter();

    /**
     * Run {@link #detect(double[])} and summarise the result.
     *
     * @param values the sample
     * @return flags with indices, count and percentage
     */
    default OutlierReport report(double[] values) {
        return new OutlierReport(getMethodName(), getParameter(), detect(values));
    }
}
