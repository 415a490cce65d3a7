package com.forecastdiag.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Index-aligned pair of actual and forecast observations.
 *
 * <p>
 * Position {@code i} of {@link #actual()} corresponds to position {@code i}
 * of {@link #forecast()}. Both series always have the same length.
 * </p>
 *
 * @since 1.0.0
 */
public final class ActualForecastPair implements Serializable {

    private static final long serialVersionUID = 1L;

    private final NumericSeries actual;
    private final NumericSeries forecast;

    /**
     * @param actual   observed values; must not be {@code null}
     * @param forecast forecast values; must not be {@code null}
     * @throws IllegalArgumentException if the lengths differ
     */
    public ActualForecastPair(NumericSeries actual, NumericSeries forecast) {
        this.actual = Objects.requireNonNull(actual, "actual must not be null");
        this.forecast = Objects.requireNonNull(forecast, "forecast must not be null");
        if (actual.size() != forecast.size()) {
            throw new IllegalArgumentException("actual and forecast must have the same length, got "
                    + actual.size() + " and " + forecast.size());
        }
    }

    /**
     * Convenience factory over raw arrays.
     *
     * @param actual   observed values
     * @param forecast forecast values
     * @return a validated pair
     * @throws IllegalArgumentException if either array is empty, contains a
     *                                  non-finite value, or the lengths differ
     */
    public static ActualForecastPair of(double[] actual, double[] forecast) {
        Objects.requireNonNull(actual, "actual must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");
        if (actual.length != forecast.length) {
            throw new IllegalArgumentException("actual and forecast must have the same length, got "
                    + actual.length + " and " + forecast.length);
        }
        return new ActualForecastPair(NumericSeries.of(actual), NumericSeries.of(forecast));
    }

    public NumericSeries actual() {
        return actual;
    }

    public NumericSeries forecast() {
        return forecast;
    }

    public int size() {
        return actual.size();
    }

    /**
     * Return the pair with the roles of actual and forecast exchanged.
     *
     * @return swapped pair
     */
    public ActualForecastPair swapped() {
        return new ActualForecastPair(forecast, actual);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ActualForecastPair that))
            return false;
        return actual.equals(that.actual) && forecast.equals(that.forecast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(actual, forecast);
    }

    @Override
    public String toString() {
        return "ActualForecastPair{size=" + size() + '}';
    }
}
