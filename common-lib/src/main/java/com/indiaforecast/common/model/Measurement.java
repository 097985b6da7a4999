package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * A numeric value with its unit. Units are normalised on construction (trimmed,
 * lower-case) so two measurements are comparable iff {@link #sameUnitAs} holds.
 */
public record Measurement(
    @JsonProperty("value") double value,
    @JsonProperty("unit")  String unit
) {
    public Measurement {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Measurement value must be finite, got " + value);
        }
        unit = normalizeUnit(unit);
    }

    public static Measurement of(double value, String unit) {
        return new Measurement(value, unit);
    }

    public boolean sameUnitAs(Measurement other) {
        return other != null && unit.equals(other.unit);
    }

    static String normalizeUnit(String unit) {
        return Objects.requireNonNullElse(unit, "").trim().toLowerCase(Locale.ROOT);
    }
}
