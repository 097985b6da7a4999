package com.indiaforecast.forecast.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.forecast.orchestrator.FetchFailure;
import com.indiaforecast.forecast.orchestrator.TrendPoint;

import java.util.List;
import java.util.Map;

public record TrendReport(
    @JsonProperty("fromYear") int fromYear,
    @JsonProperty("toYear")   int toYear,
    @JsonProperty("step")     int step,
    @JsonProperty("series")   Map<Sector, List<TrendPoint>> series,
    @JsonProperty("failures") List<FetchFailure> failures
) {
}
