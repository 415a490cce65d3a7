package com.forecastdiag.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes one configured outlier check.
 *
 * <p>
 * Supported methods:
 * </p>
 * <ul>
 * <li>{@code zscore}: absolute z-score above {@code threshold}</li>
 * <li>{@code iqr}: outside the Tukey fences, {@code threshold} is the
 * multiplier</li>
 * <li>{@code modified_zscore}: median/MAD score above {@code threshold}</li>
 * <li>{@code mahalanobis}: distance above the
 * {@code (1 - contamination)} percentile</li>
 * </ul>
 *
 * <p>
 * A {@code threshold} or {@code contamination} left unset (zero) means the
 * method's default. Call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Rule name used in logs and reports. */
    private String name;

    /** Detection method, normalised to lowercase. */
    private String method;

    /** Threshold or multiplier; 0 selects the method default. */
    private double threshold;

    /** Expected anomaly share for {@code mahalanobis}; 0 selects the default. */
    private double contamination;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the rule names a known method with legal parameters.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (method == null || method.isBlank()) {
            errors.add("Rule 'method' is required");
        }
        if (threshold < 0) {
            errors.add("Rule '" + name + "' requires 'threshold' >= 0");
        }

        if (method != null) {
            switch (method) {
                case "zscore", "iqr", "modified_zscore" -> {
                    if (contamination != 0) {
                        errors.add("Rule '" + name + "' does not use 'contamination'");
                    }
                }
                case "mahalanobis" -> {
                    if (contamination < 0 || contamination >= 1) {
                        errors.add("Mahalanobis rule '" + name + "' requires 'contamination' in (0, 1)");
                    }
                }
                default -> errors.add("Unknown outlier method: '" + method
                        + "'. Supported: zscore, iqr, modified_zscore, mahalanobis");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid OutlierRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Set the method, normalised to lowercase.
     *
     * @param method method name
     */
    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OutlierRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(method, that.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, method);
    }

    @Override
    public String toString() {
        return "OutlierRule{" +
                "name='" + name + '\'' +
                ", method='" + method + '\'' +
                ", threshold=" + threshold +
                ", contamination=" + contamination +
                '}';
    }
}
