package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LikelihoodAssessment(
    @JsonProperty("prediction")    Prediction prediction,
    @JsonProperty("probability")   double probability,
    @JsonProperty("confidence")    ConfidenceLevel confidence,
    @JsonProperty("outlook")       LikelihoodOutlook outlook,
    @JsonProperty("progressRatio") double progressRatio,
    @JsonProperty("timeRatio")     double timeRatio,
    @JsonProperty("rationale")     List<String> rationale
) {
    public LikelihoodAssessment {
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }
}
