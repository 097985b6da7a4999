package com.indiaforecast.common.classification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.Sector;

/**
 * Accuracy summary of one sector's past forecasts. {@code sampleSize} counts resolved
 * classifications only; UNRESOLVED ones are reported separately.
 */
public record SectorAccuracy(
    @JsonProperty("sector")                Sector sector,
    @JsonProperty("sampleSize")            int sampleSize,
    @JsonProperty("early")                 int early,
    @JsonProperty("onTime")                int onTime,
    @JsonProperty("late")                  int late,
    @JsonProperty("unresolved")            int unresolved,
    @JsonProperty("accuracyRate")          double accuracyRate,
    @JsonProperty("meanAbsoluteDeviation") double meanAbsoluteDeviation
) {
    public static SectorAccuracy empty(Sector sector) {
        return new SectorAccuracy(sector, 0, 0, 0, 0, 0, 0.0, 0.0);
    }

    public boolean hasHistory() {
        return sampleSize > 0;
    }
}
