package com.forecastdiag.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * How the seasonal and residual components combine with the trend.
 *
 * @since 1.0.0
 */
public enum DecompositionMode {

    /** {@code observed = trend + seasonal + residual}. */
    ADDITIVE("additive"),

    /** {@code observed = trend * seasonal * residual}; needs positive data. */
    MULTIPLICATIVE("multiplicative");

    private final String label;

    DecompositionMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a mode name, case-insensitively.
     *
     * @param name {@code additive} or {@code multiplicative}
     * @return the matching mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DecompositionMode fromLabel(String name) {
        Objects.requireNonNull(name, "Decomposition mode must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "additive" -> ADDITIVE;
            case "multiplicative" -> MULTIPLICATIVE;
            default -> throw new IllegalArgumentException(
                    "Unknown decomposition mode: '" + name
                            + "'. Supported modes: additive, multiplicative");
        };
    }
}
