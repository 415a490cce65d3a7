package com.forecastdiag.core.accuracy;

import com.forecastdiag.core.model.InformationCriteria;
import com.forecastdiag.core.util.Stats;

/**
 * Information criteria computed from model residuals under a Gaussian
 * likelihood, up to an additive constant:
 *
 * <pre>
 * AIC  = n ln(SSE / n) + 2k
 * BIC  = n ln(SSE / n) + k ln(n)
 * HQIC = n ln(SSE / n) + 2k ln(ln(n))
 * </pre>
 *
 * <p>
 * A perfect fit ({@code SSE == 0}) yields negative infinity for all three.
 * HQIC is undefined for a single residual and is then {@link Double#NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class InformationCriteriaCalculator {

    /**
     * @param residuals   model residuals
     * @param parameterCount number of estimated parameters, {@code >= 0}
     * @return AIC, BIC and HQIC
     * @throws IllegalArgumentException if {@code residuals} is empty or
     *                                  {@code parameterCount} is negative
     */
    public InformationCriteria compute(double[] residuals, int parameterCount) {
        Stats.requireNonEmpty(residuals, "residuals");
        if (parameterCount < 0) {
            throw new IllegalArgumentException("parameterCount must be >= 0, got: " + parameterCount);
        }
        int n = residuals.length;
        double sse = 0;
        for (double r : residuals) {
            sse += r * r;
        }
        double fit = n * Math.log(sse / n);
        double k = parameterCount;

        double aic = fit + 2 * k;
        double bic = fit + k * Math.log(n);
        double hqic = n > 1 ? fit + 2 * k * Math.log(Math.log(n)) : Double.NaN;
        return new InformationCriteria(aic, bic, hqic);
    }
}
