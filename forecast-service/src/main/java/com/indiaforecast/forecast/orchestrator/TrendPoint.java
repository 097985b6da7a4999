package com.indiaforecast.forecast.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.Prediction;

import java.util.List;

/**
 * One year of a sector's trend series: what was measured (past and current years) or
 * what is targeted (future years).
 */
public record TrendPoint(
    @JsonProperty("year")    int year,
    @JsonProperty("actuals") List<ActualRecord> actuals,
    @JsonProperty("targets") List<Prediction> targets
) {
    public TrendPoint {
        actuals = List.copyOf(actuals);
        targets = List.copyOf(targets);
    }
}
