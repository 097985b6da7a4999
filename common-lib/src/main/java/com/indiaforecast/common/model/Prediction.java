package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An unresolved target: announced in {@code announcementYear}, due in {@code targetYear},
 * with the partial actual observed so far.
 *
 * <p>A zero target value is rejected here so that progress ratios downstream are always
 * defined.
 */
public record Prediction(
    @JsonProperty("metric")           String metric,
    @JsonProperty("targetValue")      Measurement targetValue,
    @JsonProperty("currentProgress")  Measurement currentProgress,
    @JsonProperty("source")           SourceId source,
    @JsonProperty("sector")           Sector sector,
    @JsonProperty("announcementYear") int announcementYear,
    @JsonProperty("targetYear")       int targetYear,
    @JsonProperty("provenanceUrl")    String provenanceUrl,
    @JsonProperty("rawConfidence")    RawConfidence rawConfidence
) {
    public Prediction {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(targetValue, "targetValue");
        Objects.requireNonNull(currentProgress, "currentProgress");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sector, "sector");
        if (targetValue.value() == 0.0) {
            throw new IllegalArgumentException("Prediction target value must be non-zero: " + metric);
        }
        if (!targetValue.sameUnitAs(currentProgress)) {
            throw new IllegalArgumentException("Progress unit '" + currentProgress.unit()
                + "' does not match target unit '" + targetValue.unit() + "' for " + metric);
        }
        if (targetYear < announcementYear) {
            throw new IllegalArgumentException("Target year " + targetYear
                + " precedes announcement year " + announcementYear + " for " + metric);
        }
        rawConfidence = Objects.requireNonNullElse(rawConfidence, RawConfidence.MEDIUM);
    }
}
