/**
 * Unit-root (ADF) and level-stationarity (KPSS) testing.
 *
 * <p>
 * {@link com.forecastdiag.core.stationarity.StationarityTester} is the entry
 * point; the individual tests are package-private.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastdiag.core.stationarity;
