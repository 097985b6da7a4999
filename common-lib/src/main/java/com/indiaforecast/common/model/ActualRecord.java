package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** The realised value of a metric for one sector and year, as reported by a source. */
public record ActualRecord(
    @JsonProperty("metric")        String metric,
    @JsonProperty("actualValue")   Measurement actualValue,
    @JsonProperty("sector")        Sector sector,
    @JsonProperty("year")          int year,
    @JsonProperty("source")        SourceId source,
    @JsonProperty("provenanceUrl") String provenanceUrl
) {
    public ActualRecord {
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(actualValue, "actualValue");
        Objects.requireNonNull(sector, "sector");
        Objects.requireNonNull(source, "source");
    }
}
