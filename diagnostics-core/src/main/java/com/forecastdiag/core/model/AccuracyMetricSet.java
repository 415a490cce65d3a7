package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-forecast accuracy metrics for one actual/forecast pair.
 *
 * <p>
 * Percentage metrics ({@code mape}, {@code wape}, {@code smape}) are
 * expressed in percent. A metric whose denominator is empty or zero is
 * {@link Double#NaN}; callers must check {@link Double#isFinite(double)}
 * before displaying or aggregating.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "mape", "wape", "mae", "rmse", "bias", "smape", "mse" })
public final class AccuracyMetricSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mape;
    private final double wape;
    private final double mae;
    private final double rmse;
    private final double bias;
    private final double smape;
    private final double mse;

    public AccuracyMetricSet(double mape, double wape, double mae, double rmse,
            double bias, double smape, double mse) {
        this.mape = mape;
        this.wape = wape;
        this.mae = mae;
        this.rmse = rmse;
        this.bias = bias;
        this.smape = smape;
        this.mse = mse;
    }

    @JsonProperty("mape")
    public double getMape() {
        return mape;
    }

    @JsonProperty("wape")
    public double getWape() {
        return wape;
    }

    @JsonProperty("mae")
    public double getMae() {
        return mae;
    }

    @JsonProperty("rmse")
    public double getRmse() {
        return rmse;
    }

    /**
     * @return mean of {@code forecast - actual}; positive means systematic
     *         over-forecasting
     */
    @JsonProperty("bias")
    public double getBias() {
        return bias;
    }

    @JsonProperty("smape")
    public double getSmape() {
        return smape;
    }

    @JsonProperty("mse")
    public double getMse() {
        return mse;
    }

    /**
     * Return the metrics keyed by their short names, in declaration order.
     *
     * @return unmodifiable metric map
     */
    @JsonIgnore
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("mape", mape);
        map.put("wape", wape);
        map.put("mae", mae);
        map.put("rmse", rmse);
        map.put("bias", bias);
        map.put("smape", smape);
        map.put("mse", mse);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AccuracyMetricSet that))
            return false;
        return asMap().equals(that.asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "AccuracyMetricSet" + asMap();
    }
}
