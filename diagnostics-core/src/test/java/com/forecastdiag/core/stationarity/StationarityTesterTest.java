package com.forecastdiag.core.stationarity;

import com.forecastdiag.core.SyntheticSeries;
import com.forecastdiag.core.model.NumericSeries;
import com.forecastdiag.core.model.StationarityVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StationarityTester}.
 */
class StationarityTesterTest {

    private final StationarityTester tester = new StationarityTester();

    @Test
    @DisplayName("Should accept a weakly autocorrelated process as stationary")
    void shouldAcceptStationaryProcess() {
        double[] values = new SyntheticSeries(42).autoregressive(250, 0.3);

        StationarityVerdict verdict = tester.test(values);

        assertThat(verdict.getAdfStatistic()).isLessThan(-10);
        assertThat(verdict.getAdfPValue()).isLessThan(0.01);
        assertThat(verdict.getKpssPValue()).isCloseTo(0.10, within(1e-12));
        assertThat(verdict.isAdfStationary()).isTrue();
        assertThat(verdict.isKpssStationary()).isTrue();
        assertThat(verdict.isStationary()).isTrue();
    }

    @Test
    @DisplayName("Should reject a random walk as non-stationary")
    void shouldRejectRandomWalk() {
        double[] values = new SyntheticSeries(2024).autoregressive(250, 1.0);

        StationarityVerdict verdict = tester.test(NumericSeries.of(values));

        assertThat(verdict.getAdfPValue()).isGreaterThan(0.3);
        assertThat(verdict.getKpssPValue()).isLessThan(0.05);
        assertThat(verdict.isAdfStationary()).isFalse();
        assertThat(verdict.isKpssStationary()).isFalse();
        assertThat(verdict.isStationary()).isFalse();
    }

    @Test
    @DisplayName("Should report non-stationary when the two tests disagree")
    void shouldCombineDisagreeingTests() {
        double[] values = new SyntheticSeries(7).autoregressive(250, 1.0);

        StationarityVerdict verdict = tester.test(values);

        assertThat(verdict.isAdfStationary()).isTrue();
        assertThat(verdict.isKpssStationary()).isFalse();
        assertThat(verdict.isStationary()).isFalse();
    }

    @Test
    @DisplayName("Should bound the selected ADF lag by the Schwert rule")
    void shouldBoundAdfLag() {
        StationarityVerdict verdict = tester.test(new SyntheticSeries(3).autoregressive(250, 0.5));

        assertThat(verdict.getAdfUsedLag()).isBetween(0, AdfTest.maxLag(250));
        assertThat(AdfTest.maxLag(250)).isEqualTo(16);
        assertThat(verdict.getKpssLags()).isGreaterThanOrEqualTo(0);
        assertThat(verdict.getKpssPValue()).isBetween(0.01, 0.10);
    }

    @Test
    @DisplayName("Should test a series of tiny magnitude like its rescaled original")
    void shouldTestTinyMagnitudeSeries() {
        double[] values = new SyntheticSeries(42).autoregressive(250, 0.3);
        double[] tiny = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            tiny[i] = values[i] * 1e-13;
        }

        StationarityVerdict expected = tester.test(values);
        StationarityVerdict verdict = tester.test(tiny);

        assertThat(verdict.getAdfStatistic()).isFinite();
        assertThat(verdict.getAdfStatistic()).isCloseTo(expected.getAdfStatistic(), within(1e-6));
        assertThat(verdict.getKpssStatistic()).isCloseTo(expected.getKpssStatistic(), within(1e-6));
        assertThat(verdict.isStationary()).isTrue();
    }

    @Test
    @DisplayName("Should return an undefined verdict for a constant series")
    void shouldHandleConstantSeries() {
        StationarityVerdict verdict = tester.test(new double[] { 5, 5, 5, 5, 5, 5 });

        assertThat(verdict.getAdfStatistic()).isNaN();
        assertThat(verdict.getKpssStatistic()).isNaN();
        assertThat(verdict.isStationary()).isFalse();
    }

    @Test
    @DisplayName("Should return an undefined verdict for a straight line")
    void shouldHandleLinearSeries() {
        double[] values = new double[50];
        for (int i = 0; i < values.length; i++) {
            values[i] = 0.1 * i + 3;
        }

        assertThat(tester.test(values)).isEqualTo(StationarityVerdict.undefined());
    }

    @Test
    @DisplayName("Should drop non-finite values before testing")
    void shouldDropNonFiniteValues() {
        double[] values = new SyntheticSeries(42).autoregressive(250, 0.3);
        double[] withGaps = new double[values.length + 2];
        System.arraycopy(values, 0, withGaps, 1, values.length);
        withGaps[0] = Double.NaN;
        withGaps[withGaps.length - 1] = Double.POSITIVE_INFINITY;

        assertThat(tester.test(withGaps)).isEqualTo(tester.test(values));
    }

    @Test
    @DisplayName("Should require at least four finite values")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> tester.test(new double[] { 1, 3, 2, Double.NaN }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 4");
    }
}
