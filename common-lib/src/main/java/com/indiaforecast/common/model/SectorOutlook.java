package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Overall verdict for one sector's open targets.
 *
 * @param outlook         majority-leaning outlook across the sector's predictions
 * @param confidenceScore in [0, 1]; 0 when the sector has no predictions
 */
public record SectorOutlook(
    @JsonProperty("sector")          Sector sector,
    @JsonProperty("outlook")         LikelihoodOutlook outlook,
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("predictions")     int predictions
) {
    public SectorOutlook {
        Objects.requireNonNull(sector, "sector");
        Objects.requireNonNull(outlook, "outlook");
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be in [0, 1], got " + confidenceScore);
        }
    }
}
