package com.indiaforecast.forecast.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.classification.HistoricalAccuracyStats;
import com.indiaforecast.common.model.ClassificationResult;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.ToleranceBand;
import com.indiaforecast.forecast.orchestrator.FetchFailure;

import java.util.List;
import java.util.Map;

/** Classification of the forecasts made in one year about another, with per-sector accuracy. */
public record AccuracyReport(
    @JsonProperty("forecastYear")  int forecastYear,
    @JsonProperty("targetYear")    int targetYear,
    @JsonProperty("toleranceBand") ToleranceBand toleranceBand,
    @JsonProperty("results")       Map<Sector, List<ClassificationResult>> results,
    @JsonProperty("statistics")    HistoricalAccuracyStats statistics,
    @JsonProperty("failures")      List<FetchFailure> failures
) {
    public List<ClassificationResult> allResults() {
        return results.values().stream().flatMap(List::stream).toList();
    }
}
