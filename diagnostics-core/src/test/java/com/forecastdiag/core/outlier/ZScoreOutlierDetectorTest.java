package com.forecastdiag.core.outlier;

import com.forecastdiag.core.model.OutlierReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ZScoreOutlierDetector}.
 */
class ZScoreOutlierDetectorTest {

    private final ZScoreOutlierDetector detector = new ZScoreOutlierDetector();

    @Test
    @DisplayName("Should flag an extreme value among a constant background")
    void shouldFlagExtremeValue() {
        double[] values = { 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 100 };

        OutlierReport report = detector.report(values);

        assertThat(report.getIndices()).containsExactly(10);
        assertThat(report.getCount()).isEqualTo(1);
        assertThat(report.getMethod()).isEqualTo("zscore");
        assertThat(report.getThreshold()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should NOT flag anything when all values are identical")
    void shouldNotFlagConstantInput() {
        boolean[] flags = detector.detect(new double[] { 7, 7, 7, 7 });

        assertThat(flags).containsOnly(false);
    }

    @Test
    @DisplayName("Should flag more points with a lower threshold")
    void shouldFlagMoreWithLowerThreshold() {
        double[] values = { 10, 11, 9, 10, 12, 8, 10, 30 };

        int strict = new ZScoreOutlierDetector(3.0).report(values).getCount();
        int loose = new ZScoreOutlierDetector(1.0).report(values).getCount();

        assertThat(loose).isGreaterThan(strict);
    }

    @Test
    @DisplayName("Should return a flag per input value")
    void shouldReturnFlagPerValue() {
        assertThat(detector.detect(new double[] { 3, 1, 4, 1, 5 })).hasSize(5);
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new ZScoreOutlierDetector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
