package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered sequence of finite real numbers.
 *
 * <p>
 * A series may optionally carry one timestamp per value. Timestamps are
 * informational only: decomposition and stationarity testing assume a regular
 * index and never look at them.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>at least one value</li>
 * <li>every value is finite</li>
 * <li>if present, exactly one timestamp per value</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "values", "timestamps" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NumericSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] values;
    private final List<Instant> timestamps;

    private NumericSeries(double[] values, List<Instant> timestamps) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Series must contain at least one value");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException(
                        "Series value at index " + i + " is not finite: " + values[i]);
            }
        }
        if (timestamps != null && timestamps.size() != values.length) {
            throw new IllegalArgumentException("Expected " + values.length
                    + " timestamps but got " + timestamps.size());
        }
        this.values = values.clone();
        this.timestamps = timestamps != null
                ? Collections.unmodifiableList(new ArrayList<>(timestamps))
                : null;
    }

    /**
     * Create a series without timestamps.
     *
     * @param values the observations; copied
     * @return a new series
     * @throws IllegalArgumentException if {@code values} is empty or contains a
     *                                  non-finite value
     */
    public static NumericSeries of(double... values) {
        return new NumericSeries(values, null);
    }

    /**
     * Create a series with one timestamp per value.
     *
     * @param values     the observations; copied
     * @param timestamps observation times, same length as {@code values}
     * @return a new series
     * @throws IllegalArgumentException if the lengths differ or a value is
     *                                  invalid
     */
    public static NumericSeries of(double[] values, List<Instant> timestamps) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        return new NumericSeries(values, timestamps);
    }

    /**
     * @return a copy of the values
     */
    @JsonProperty("values")
    public double[] values() {
        return values.clone();
    }

    /**
     * @return unmodifiable timestamps, or {@code null} if the series has none
     */
    @JsonProperty("timestamps")
    public List<Instant> timestamps() {
        return timestamps;
    }

    public boolean hasTimestamps() {
        return timestamps != null;
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NumericSeries that))
            return false;
        return Arrays.equals(values, that.values) && Objects.equals(timestamps, that.timestamps);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Objects.hashCode(timestamps);
    }

    @Override
    public String toString() {
        return "NumericSeries{size=" + values.length
                + ", timestamps=" + (timestamps != null) + '}';
    }
}
