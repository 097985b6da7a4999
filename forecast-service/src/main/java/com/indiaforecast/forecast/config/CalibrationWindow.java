package com.indiaforecast.forecast.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.exception.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.List;

/** A (forecastYear, targetYear) pair whose resolved forecasts feed the sector accuracy history. */
public record CalibrationWindow(
    @JsonProperty("forecastYear") int forecastYear,
    @JsonProperty("targetYear")   int targetYear
) {
    static final String PROPERTY = "forecast.likelihood.calibration-windows";

    public CalibrationWindow {
        if (targetYear < forecastYear) {
            throw new InvalidConfigurationException(PROPERTY,
                "target year " + targetYear + " precedes forecast year " + forecastYear);
        }
    }

    /** Parses {@code "1975:2000,1997:2002"}. Blank input yields no windows. */
    public static List<CalibrationWindow> parseList(String value) {
        List<CalibrationWindow> windows = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return windows;
        }
        for (String token : value.split(",")) {
            String[] parts = token.trim().split(":");
            if (parts.length != 2) {
                throw new InvalidConfigurationException(PROPERTY, "expected forecastYear:targetYear, got '" + token.trim() + "'");
            }
            try {
                windows.add(new CalibrationWindow(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException(PROPERTY, "non-numeric year in '" + token.trim() + "'");
            }
        }
        return List.copyOf(windows);
    }
}
