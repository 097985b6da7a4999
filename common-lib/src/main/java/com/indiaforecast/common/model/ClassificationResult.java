package com.indiaforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A forecast paired with its matched actual (or {@code null}) and the resulting status.
 * {@code deviationRatio} is {@code null} exactly when the status is
 * {@link ClassificationStatus#UNRESOLVED}.
 */
public record ClassificationResult(
    @JsonProperty("forecast")       ForecastRecord forecast,
    @JsonProperty("actual")         ActualRecord actual,
    @JsonProperty("status")         ClassificationStatus status,
    @JsonProperty("deviationRatio") Double deviationRatio,
    @JsonProperty("toleranceBand")  ToleranceBand toleranceBand
) {
    public static ClassificationResult unresolved(ForecastRecord forecast, ToleranceBand band) {
        return new ClassificationResult(forecast, null, ClassificationStatus.UNRESOLVED, null, band);
    }
}
