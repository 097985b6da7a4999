package com.indiaforecast.forecast.fetcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.RawConfidence;
import com.indiaforecast.common.model.Sector;

import java.util.List;

/**
 * Bundled extract of a source's published documents. Sectors use their display names
 * ({@code "Social Development"}); see {@code src/main/resources/catalog/}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogDocument(
    @JsonProperty("source")    String source,
    @JsonProperty("version")   String version,
    @JsonProperty("forecasts") List<Forecast> forecasts,
    @JsonProperty("actuals")   List<Actual> actuals,
    @JsonProperty("targets")   List<Target> targets
) {
    public CatalogDocument {
        forecasts = forecasts == null ? List.of() : List.copyOf(forecasts);
        actuals   = actuals == null ? List.of() : List.copyOf(actuals);
        targets   = targets == null ? List.of() : List.copyOf(targets);
    }

    public record Forecast(
        @JsonProperty("metric")       String metric,
        @JsonProperty("sector")       String sector,
        @JsonProperty("value")        double value,
        @JsonProperty("unit")         String unit,
        @JsonProperty("forecastYear") int forecastYear,
        @JsonProperty("targetYear")   int targetYear,
        @JsonProperty("document")     String document,
        @JsonProperty("url")          String url,
        @JsonProperty("confidence")   RawConfidence confidence
    ) {
        boolean in(Sector s) {
            return Sector.fromLabel(sector) == s;
        }
    }

    public record Actual(
        @JsonProperty("metric") String metric,
        @JsonProperty("sector") String sector,
        @JsonProperty("value")  double value,
        @JsonProperty("unit")   String unit,
        @JsonProperty("year")   int year,
        @JsonProperty("url")    String url
    ) {
        boolean in(Sector s) {
            return Sector.fromLabel(sector) == s;
        }
    }

    public record Target(
        @JsonProperty("metric")           String metric,
        @JsonProperty("sector")           String sector,
        @JsonProperty("targetValue")      double targetValue,
        @JsonProperty("progressValue")    double progressValue,
        @JsonProperty("unit")             String unit,
        @JsonProperty("announcementYear") int announcementYear,
        @JsonProperty("targetYear")       int targetYear,
        @JsonProperty("url")              String url,
        @JsonProperty("confidence")       RawConfidence confidence
    ) {
        boolean in(Sector s) {
            return Sector.fromLabel(sector) == s;
        }
    }
}
