package com.indiaforecast.forecast.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.classification.HistoricalAccuracyStats;
import com.indiaforecast.common.model.LikelihoodAssessment;
import com.indiaforecast.common.model.LikelihoodOutlook;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SectorOutlook;
import com.indiaforecast.forecast.orchestrator.FetchFailure;

import java.util.List;
import java.util.Map;

public record LikelihoodReport(
    @JsonProperty("targetYear")    int targetYear,
    @JsonProperty("assessments")   Map<Sector, List<LikelihoodAssessment>> assessments,
    @JsonProperty("outlookCounts") Map<LikelihoodOutlook, Integer> outlookCounts,
    @JsonProperty("bySector")      Map<Sector, SectorOutlook> bySector,
    @JsonProperty("history")       HistoricalAccuracyStats history,
    @JsonProperty("failures")      List<FetchFailure> failures
) {
    public List<LikelihoodAssessment> allAssessments() {
        return assessments.values().stream().flatMap(List::stream).toList();
    }
}
