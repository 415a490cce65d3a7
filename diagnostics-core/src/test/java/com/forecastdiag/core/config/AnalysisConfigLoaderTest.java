package com.forecastdiag.core.config;

import com.forecastdiag.core.interval.IntervalEstimator;
import com.forecastdiag.core.model.DecompositionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfigLoader}.
 */
class AnalysisConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath("test-analysis.yml");

        assertThat(config.getConfidenceLevel()).isEqualTo(0.9);
        assertThat(config.getBootstrapIterations()).isEqualTo(500);
        assertThat(config.getIntervalLevels()).containsExactly(0.8, 0.95);
        assertThat(config.decompositionModeValue()).isEqualTo(DecompositionMode.MULTIPLICATIVE);
        assertThat(config.getPeriod()).isEqualTo(7);
        assertThat(config.getOutlierRules()).hasSize(2);
        assertThat(config.getOutlierRules().get(0).getName()).isEqualTo("test_zscore");
        assertThat(config.getOutlierRules().get(0).getThreshold()).isEqualTo(2.5);
        assertThat(config.getOutlierRules().get(1).getMethod()).isEqualTo("modified_zscore");
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaultResource() {
        AnalysisConfig config = AnalysisConfigLoader.fromClasspath(AnalysisConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getOutlierRules()).extracting(OutlierRule::getMethod)
                .containsExactly("zscore", "iqr", "mahalanobis");
        assertThat(config.getPeriod()).isNull();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromClasspath("invalid-analysis.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("confidenceLevel")
                .hasMessageContaining("Unknown decomposition mode: 'exponential'")
                .hasMessageContaining("Unknown outlier method: 'magic'");
    }

    @Test
    @DisplayName("Should load configuration from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("analysis.yml");
        Files.writeString(file, "confidenceLevel: 0.8\noutlierRules:\n  - name: wide\n    method: iqr\n"
                + "    threshold: 3.0\n", StandardCharsets.UTF_8);

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getConfidenceLevel()).isEqualTo(0.8);
        assertThat(config.getBootstrapIterations()).isEqualTo(1000);
        assertThat(config.getIntervalLevels()).containsExactly(0.5, 0.8, 0.95);
        assertThat(config.decompositionModeValue()).isEqualTo(DecompositionMode.ADDITIVE);
        assertThat(config.getOutlierRules()).hasSize(1);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "", StandardCharsets.UTF_8);

        AnalysisConfig config = AnalysisConfigLoader.fromFile(file.toString());

        assertThat(config.getConfidenceLevel()).isEqualTo(0.95);
        assertThat(config.getOutlierRules()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> AnalysisConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }
    @Test
    @DisplayName("Should parse an inline document")
    void shouldLoadFromString() {
        AnalysisConfig config = AnalysisConfigLoader.fromString(
                "decompositionMode: MULTIPLICATIVE\nperiod: 12\n");

        assertThat(config.decompositionModeValue()).isEqualTo(DecompositionMode.MULTIPLICATIVE);
        assertThat(config.getPeriod()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should use the estimator default levels when none are listed")
    void shouldDefaultIntervalLevels() {
        AnalysisConfig config = AnalysisConfigLoader.fromString("intervalLevels: []\n");

        assertThat(config.getIntervalLevels()).containsExactlyElementsOf(IntervalEstimator.DEFAULT_LEVELS);
        assertThat(config.getBootstrapIterations()).isEqualTo(IntervalEstimator.DEFAULT_BOOTSTRAP_ITERATIONS);
    }

    @Test
    @DisplayName("Should drop duplicate interval levels and keep their order")
    void shouldDeduplicateIntervalLevels() {
        AnalysisConfig config = AnalysisConfigLoader.fromString("intervalLevels: [0.95, 0.8, 0.95]\n");

        assertThat(config.getIntervalLevels()).containsExactly(0.95, 0.8);
    }

    @Test
    @DisplayName("Should reject an integer interval level outside (0, 1)")
    void shouldRejectIntegerLevel() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromString("intervalLevels: [1, 0.5]\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'intervalLevels' entries must be in (0, 1), got: 1.0");
    }

    @Test
    @DisplayName("Should reject two rules with the same name")
    void shouldRejectDuplicateRuleNames() {
        String yaml = "outlierRules:\n"
                + "  - name: spikes\n    method: zscore\n"
                + "  - name: spikes\n    method: iqr\n";

        assertThatThrownBy(() -> AnalysisConfigLoader.fromString(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate outlier rule name: 'spikes'");
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> AnalysisConfigLoader.fromString("intervalLevels: [0.5, 0.8\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed analysis configuration");
    }
}
