package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Akaike, Bayesian and Hannan-Quinn information criteria for a fitted model.
 * Lower is better within one criterion.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "aic", "bic", "hqic" })
public final class InformationCriteria implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double aic;
    private final double bic;
    private final double hqic;

    public InformationCriteria(double aic, double bic, double hqic) {
        this.aic = aic;
        this.bic = bic;
        this.hqic = hqic;
    }

    @JsonProperty("aic")
    public double getAic() {
        return aic;
    }

    @JsonProperty("bic")
    public double getBic() {
        return bic;
    }

    @JsonProperty("hqic")
    public double getHqic() {
        return hqic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof InformationCriteria that))
            return false;
        return Double.compare(aic, that.aic) == 0
                && Double.compare(bic, that.bic) == 0
                && Double.compare(hqic, that.hqic) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(aic, bic, hqic);
    }

    @Override
    public String toString() {
        return "InformationCriteria{aic=" + aic + ", bic=" + bic + ", hqic=" + hqic + '}';
    }
}
