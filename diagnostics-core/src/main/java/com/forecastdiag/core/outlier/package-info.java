/**
 * Pluggable outlier detection.
 *
 * <p>
 * All detectors implement the
 * {@link com.forecastdiag.core.outlier.OutlierDetector} interface and can be
 * created from configuration via
 * {@link com.forecastdiag.core.outlier.DetectorFactory}. Built-in methods:
 * </p>
 * <ul>
 * <li>{@link com.forecastdiag.core.outlier.ZScoreOutlierDetector}: mean ± N ×
 * σ</li>
 * <li>{@link com.forecastdiag.core.outlier.IqrOutlierDetector}: Tukey
 * fences</li>
 * <li>{@link com.forecastdiag.core.outlier.ModifiedZScoreOutlierDetector}:
 * median and MAD</li>
 * <li>{@link com.forecastdiag.core.outlier.MahalanobisOutlierDetector}:
 * covariance-scaled distance, multivariate</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a method, implement {@code OutlierDetector} and register its name in
 * {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastdiag.core.outlier;
