package com.forecastdiag.core.decomposition;

import com.forecastdiag.core.SyntheticSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PeriodicityEstimator}.
 */
class PeriodicityEstimatorTest {

    private final PeriodicityEstimator estimator = new PeriodicityEstimator();

    @Test
    @DisplayName("Should detect the period of a weekly sinusoid")
    void shouldDetectSinusoidPeriod() {
        assertThat(estimator.estimate(SyntheticSeries.sinusoid(70, 7, 0, 1))).isEqualTo(7);
    }

    @Test
    @DisplayName("Should detect the period of a repeating pattern")
    void shouldDetectRepeatingPattern() {
        double[] values = SyntheticSeries.repeat(new double[] { 2, 4, 9, 4, 2, 1, 0 }, 84);

        assertThat(estimator.estimate(values)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should detect a monthly cycle around a level")
    void shouldDetectMonthlyCycle() {
        assertThat(estimator.estimate(SyntheticSeries.sinusoid(96, 12, 10, 3))).isEqualTo(12);
    }

    @Test
    @DisplayName("Should default to 12 for a trend without a peak")
    void shouldDefaultForTrend() {
        double[] values = new double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }

        assertThat(estimator.estimate(values)).isEqualTo(PeriodicityEstimator.DEFAULT_PERIOD);
    }

    @Test
    @DisplayName("Should default to 12 for a constant series")
    void shouldDefaultForConstantSeries() {
        assertThat(estimator.estimate(new double[] { 4, 4, 4, 4, 4, 4, 4, 4 })).isEqualTo(12);
    }

    @Test
    @DisplayName("Should ignore non-finite values")
    void shouldIgnoreNonFiniteValues() {
        double[] values = SyntheticSeries.sinusoid(71, 7, 0, 1);
        double[] withGap = new double[values.length + 1];
        System.arraycopy(values, 0, withGap, 0, values.length);
        withGap[values.length] = Double.NaN;

        assertThat(estimator.estimate(withGap)).isEqualTo(estimator.estimate(values));
    }

    @Test
    @DisplayName("Should start the autocorrelation at one")
    void shouldNormaliseAutocorrelation() {
        double[] acf = estimator.autocorrelation(new double[] { 1, 3, 2, 5, 4 }, 3);

        assertThat(acf).hasSize(4);
        assertThat(acf[0]).isCloseTo(1.0, within(1e-12));
        assertThat(estimator.autocorrelation(new double[] { 2, 2, 2 }, 1)).isEmpty();
    }
}
