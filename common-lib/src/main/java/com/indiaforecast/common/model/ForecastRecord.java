package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A historical prediction, published in {@code forecastYear}, about the value a metric
 * would reach in {@code targetYear}. Immutable once returned by a fetcher.
 */
public record ForecastRecord(
    @JsonProperty("metric")         String metric,
    @JsonProperty("predictedValue") Measurement predictedValue,
    @JsonProperty("source")         SourceId source,
    @JsonProperty("sector")         Sector sector,
    @JsonProperty("forecastYear")   int forecastYear,
    @JsonProperty("targetYear")     int targetYear,
    @JsonProperty("provenanceUrl")  String provenanceUrl,
    @JsonProperty("rawConfidence")  RawConfidence rawConfidence
) {
    public ForecastRecord {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(predictedValue, "predictedValue");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sector, "sector");
        rawConfidence = Objects.requireNonNullElse(rawConfidence, RawConfidence.MEDIUM);
    }
}
