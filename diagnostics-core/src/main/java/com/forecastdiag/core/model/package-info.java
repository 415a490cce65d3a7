/**
 * Value types exchanged with the analysis components.
 *
 * <p>
 * Inputs:
 * </p>
 * <ul>
 * <li>{@link com.forecastdiag.core.model.NumericSeries}: finite values with
 * optional timestamps</li>
 * <li>{@link com.forecastdiag.core.model.ActualForecastPair}: equal-length
 * actual and forecast series</li>
 * </ul>
 * <p>
 * Results carry Jackson annotations with snake_case property names so that
 * a service layer can serialize them directly.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastdiag.core.model;
