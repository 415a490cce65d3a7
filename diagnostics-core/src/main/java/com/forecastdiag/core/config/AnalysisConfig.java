package com.forecastdiag.core.config;

import com.forecastdiag.core.interval.IntervalEstimator;
import com.forecastdiag.core.model.DecompositionMode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * The analysis components never read this object themselves; a calling
 * service loads it once and passes the values as call parameters.
 * </p>
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * confidenceLevel: 0.95
 * bootstrapIterations: 1000
 * intervalLevels: [0.5, 0.8, 0.95]
 * decompositionMode: additive
 * period: 7            # optional; detected when absent
 * outlierRules:
 *   - name: demand_spikes
 *     method: iqr
 *     threshold: 1.5
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private double confidenceLevel = 0.95;
    private int bootstrapIterations = IntervalEstimator.DEFAULT_BOOTSTRAP_ITERATIONS;
    private List<Double> intervalLevels = new ArrayList<>(IntervalEstimator.DEFAULT_LEVELS);
    private String decompositionMode = "additive";
    private Integer period;
    private List<OutlierRule> outlierRules = new ArrayList<>();

    /**
     * Validate every setting and every outlier rule.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (confidenceLevel < 0.5 || confidenceLevel > 0.99) {
            errors.add("'confidenceLevel' must be in [0.5, 0.99], got: " + confidenceLevel);
        }
        if (bootstrapIterations < 1) {
            errors.add("'bootstrapIterations' must be >= 1, got: " + bootstrapIterations);
        }
        for (Double level : intervalLevels) {
            if (level == null || !(level > 0 && level < 1)) {
                errors.add("'intervalLevels' entries must be in (0, 1), got: " + level);
            }
        }
        if (decompositionMode == null || decompositionMode.isBlank()) {
            errors.add("'decompositionMode' is required");
        } else {
            try {
                DecompositionMode.fromLabel(decompositionMode);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (period != null && period < 1) {
            errors.add("'period' must be >= 1 when set, got: " + period);
        }

        Set<String> ruleNames = new HashSet<>();
        for (int i = 0; i < outlierRules.size(); i++) {
            OutlierRule rule = Objects.requireNonNull(outlierRules.get(i),
                    "Outlier rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !ruleNames.add(rule.getName())) {
                errors.add("Duplicate outlier rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public int getBootstrapIterations() {
        return bootstrapIterations;
    }

    public void setBootstrapIterations(int bootstrapIterations) {
        this.bootstrapIterations = bootstrapIterations;
    }

    /**
     * @return unmodifiable list of prediction-interval levels
     */
    public List<Double> getIntervalLevels() {
        return Collections.unmodifiableList(intervalLevels);
    }

    public void setIntervalLevels(List<Double> intervalLevels) {
        this.intervalLevels = intervalLevels != null ? new ArrayList<>(intervalLevels) : new ArrayList<>();
    }

    public String getDecompositionMode() {
        return decompositionMode;
    }

    public void setDecompositionMode(String decompositionMode) {
        this.decompositionMode = decompositionMode;
    }

    /**
     * @return the configured mode as an enum
     * @throws IllegalArgumentException if the mode is unknown
     */
    public DecompositionMode decompositionModeValue() {
        return DecompositionMode.fromLabel(decompositionMode);
    }

    /**
     * @return fixed seasonal period, or {@code null} to detect it
     */
    public Integer getPeriod() {
        return period;
    }

    public void setPeriod(Integer period) {
        this.period = period;
    }

    /**
     * @return unmodifiable list of outlier rules
     */
    public List<OutlierRule> getOutlierRules() {
        return Collections.unmodifiableList(outlierRules);
    }

    public void setOutlierRules(List<OutlierRule> outlierRules) {
        this.outlierRules = outlierRules != null ? new ArrayList<>(outlierRules) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "confidenceLevel=" + confidenceLevel +
                ", bootstrapIterations=" + bootstrapIterations +
                ", intervalLevels=" + intervalLevels +
                ", decompositionMode='" + decompositionMode + '\'' +
                ", period=" + period +
                ", outlierRules=" + outlierRules +
                '}';
    }
}
