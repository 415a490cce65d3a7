package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one outlier-detection pass.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "method_used", "threshold", "outlier_flags", "outlier_indices",
        "outlier_count", "outlier_percentage" })
public final class OutlierReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final double threshold;
    private final boolean[] flags;
    private final List<Integer> indices;

    /**
     * @param method    name of the detection method
     * @param threshold the method's tuning parameter (threshold, multiplier
     *                  or contamination)
     * @param flags     one flag per input point; copied
     */
    public OutlierReport(String method, double threshold, boolean[] flags) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.threshold = threshold;
        this.flags = Objects.requireNonNull(flags, "flags must not be null").clone();
        List<Integer> found = new ArrayList<>();
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                found.add(i);
            }
        }
        this.indices = Collections.unmodifiableList(found);
    }

    @JsonProperty("method_used")
    public String getMethod() {
        return method;
    }

    @JsonProperty("threshold")
    public double getThreshold() {
        return threshold;
    }

    @JsonProperty("outlier_flags")
    public boolean[] getFlags() {
        return flags.clone();
    }

    @JsonProperty("outlier_indices")
    public List<Integer> getIndices() {
        return indices;
    }

    @JsonProperty("outlier_count")
    public int getCount() {
        return indices.size();
    }

    /**
     * @return share of flagged points in percent; 0 for empty input
     */
    @JsonProperty("outlier_percentage")
    public double getPercentage() {
        return flags.length == 0 ? 0.0 : indices.size() * 100.0 / flags.length;
    }

    @Override
    public String toString() {
        return "OutlierReport{method='" + method + '\'' +
                ", threshold=" + threshold +
                ", indices=" + indices +
                '}';
    }
}
