package com.indiaforecast.forecast.config;

import java.util.List;

/** The past forecast windows replayed to build per-sector accuracy history. */
public record CalibrationSettings(List<CalibrationWindow> windows) {
    public CalibrationSettings {
        windows = windows == null ? List.of() : List.copyOf(windows);
    }
}
