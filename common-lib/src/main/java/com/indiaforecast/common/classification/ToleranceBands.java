package com.indiaforecast.common.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.exception.InvalidConfigurationException;
import com.indiaforecast.common.model.ToleranceBand;

/**
 * Symmetric deviation thresholds for each {@link ToleranceBand}.
 *
 * <p>Validated on construction: every threshold must lie in (0, 1] and the bands must
 * widen strictly from strict to loose.
 */
public record ToleranceBands(
    @JsonProperty("strict")   double strict,
    @JsonProperty("moderate") double moderate,
    @JsonProperty("loose")    double loose
) {
    public static final double DEFAULT_STRICT   = 0.05;
    public static final double DEFAULT_MODERATE = 0.15;
    public static final double DEFAULT_LOOSE    = 0.25;

    public ToleranceBands {
        requireInRange("forecast.classification.strict", strict);
        requireInRange("forecast.classification.moderate", moderate);
        requireInRange("forecast.classification.loose", loose);
        if (!(strict < moderate && moderate < loose)) {
            throw new InvalidConfigurationException("forecast.classification",
                "bands must satisfy strict < moderate < loose, got "
                    + strict + " / " + moderate + " / " + loose);
        }
    }

    public static ToleranceBands defaults() {
        return new ToleranceBands(DEFAULT_STRICT, DEFAULT_MODERATE, DEFAULT_LOOSE);
    }

    public double threshold(ToleranceBand band) {
        return switch (band) {
            case STRICT   -> strict;
            case MODERATE -> moderate;
            case LOOSE    -> loose;
        };
    }

    private static void requireInRange(String property, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(property, "must be in (0, 1], got " + value);
        }
    }
}
