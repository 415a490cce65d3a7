package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Combined result of the ADF and KPSS stationarity tests.
 *
 * <p>
 * The two tests have opposite null hypotheses: ADF assumes a unit root, so
 * rejection ({@code p < 0.05}) indicates stationarity; KPSS assumes
 * stationarity, so failure to reject ({@code p > 0.05}) indicates it. The
 * combined {@link #isStationary()} requires both to agree. A disagreement is
 * a normal outcome and simply reports {@code false}.
 * </p>
 *
 * <p>
 * For degenerate input (constant series) the statistics are
 * {@link Double#NaN} and every flag is {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "adf_statistic", "adf_pvalue", "adf_used_lag", "adf_stationary",
        "kpss_statistic", "kpss_pvalue", "kpss_lags", "kpss_stationary", "is_stationary" })
public final class StationarityVerdict implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Significance threshold shared by both tests. */
    public static final double SIGNIFICANCE = 0.05;

    private final double adfStatistic;
    private final double adfPValue;
    private final int adfUsedLag;
    private final double kpssStatistic;
    private final double kpssPValue;
    private final int kpssLags;

    public StationarityVerdict(double adfStatistic, double adfPValue, int adfUsedLag,
            double kpssStatistic, double kpssPValue, int kpssLags) {
        this.adfStatistic = adfStatistic;
        this.adfPValue = adfPValue;
        this.adfUsedLag = adfUsedLag;
        this.kpssStatistic = kpssStatistic;
        this.kpssPValue = kpssPValue;
        this.kpssLags = kpssLags;
    }

    /**
     * Verdict for a series on which neither test can be computed.
     *
     * @return verdict with NaN statistics and every flag {@code false}
     */
    public static StationarityVerdict undefined() {
        return new StationarityVerdict(Double.NaN, Double.NaN, 0, Double.NaN, Double.NaN, 0);
    }

    @JsonProperty("adf_statistic")
    public double getAdfStatistic() {
        return adfStatistic;
    }

    @JsonProperty("adf_pvalue")
    public double getAdfPValue() {
        return adfPValue;
    }

    @JsonProperty("adf_used_lag")
    public int getAdfUsedLag() {
        return adfUsedLag;
    }

    @JsonProperty("adf_stationary")
    public boolean isAdfStationary() {
        return adfPValue < SIGNIFICANCE;
    }

    @JsonProperty("kpss_statistic")
    public double getKpssStatistic() {
        return kpssStatistic;
    }

    @JsonProperty("kpss_pvalue")
    public double getKpssPValue() {
        return kpssPValue;
    }

    @JsonProperty("kpss_lags")
    public int getKpssLags() {
        return kpssLags;
    }

    @JsonProperty("kpss_stationary")
    public boolean isKpssStationary() {
        return kpssPValue > SIGNIFICANCE;
    }

    @JsonProperty("is_stationary")
    public boolean isStationary() {
        return isAdfStationary() && isKpssStationary();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StationarityVerdict that))
            return false;
        return Double.compare(adfStatistic, that.adfStatistic) == 0
                && Double.compare(adfPValue, that.adfPValue) == 0
                && adfUsedLag == that.adfUsedLag
                && Double.compare(kpssStatistic, that.kpssStatistic) == 0
                && Double.compare(kpssPValue, that.kpssPValue) == 0
                && kpssLags == that.kpssLags;
    }

    @Override
    public int hashCode() {
        return Objects.hash(adfStatistic, adfPValue, adfUsedLag, kpssStatistic, kpssPValue, kpssLags);
    }

    @Override
    public String toString() {
        return "StationarityVerdict{" +
                "adfStatistic=" + adfStatistic +
                ", adfPValue=" + adfPValue +
                ", adfUsedLag=" + adfUsedLag +
                ", kpssStatistic=" + kpssStatistic +
                ", kpssPValue=" + kpssPValue +
                ", kpssLags=" + kpssLags +
                ", stationary=" + isStationary() +
                '}';
    }
}
