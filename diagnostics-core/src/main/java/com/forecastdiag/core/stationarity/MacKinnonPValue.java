package com.forecastdiag.core.stationarity;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * MacKinnon (1994) approximate asymptotic p-values for the Dickey-Fuller
 * τ statistic, constant-only regression, one integrated variable.
 *
 * <p>
 * The p-value is {@code Φ(γ₀ + γ₁τ + γ₂τ² [+ γ₃τ³])}, with one polynomial
 * below the switch point {@value #TAU_STAR} and another above it. Statistics
 * beyond the fitted range map to 0 or 1.
 * </p>
 */
final class MacKinnonPValue {

    static final double TAU_MAX = 2.74;
    static final double TAU_MIN = -18.83;
    static final double TAU_STAR = -1.61;

    private static final double[] SMALL_P = { 2.1659, 1.4412, 0.038269 };
    private static final double[] LARGE_P = { 1.7339, 0.93202, -0.12745, -0.010368 };

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private MacKinnonPValue() {
        // utility class, not instantiable
    }

    /**
     * @param tau ADF test statistic
     * @return approximate p-value, {@link Double#NaN} for a NaN statistic
     */
    static double pValue(double tau) {
        if (Double.isNaN(tau)) {
            return Double.NaN;
        }
        if (tau > TAU_MAX) {
            return 1.0;
        }
        if (tau < TAU_MIN) {
            return 0.0;
        }
        double[] coefficients = tau <= TAU_STAR ? SMALL_P : LARGE_P;
        double z = 0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            z = z * tau + coefficients[i];
        }
        return STANDARD_NORMAL.cumulativeProbability(z);
    }
}
