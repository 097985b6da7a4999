package com.indiaforecast.forecast.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.registry.FetchCapability;

/** One (sector, source) pair that produced no answer, with the reason. */
public record FetchFailure(
    @JsonProperty("sector")    Sector sector,
    @JsonProperty("source")    SourceId source,
    @JsonProperty("operation") FetchCapability operation,
    @JsonProperty("kind")      FailureKind kind,
    @JsonProperty("message")   String message
) {
    static FetchFailure of(Sector sector, SourceId source, FetchCapability operation, Throwable error) {
        FailureKind kind = error instanceof SourceParseException
            ? FailureKind.PARSE_ERROR : FailureKind.SOURCE_UNAVAILABLE;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new FetchFailure(sector, source, operation, kind, message);
    }
}
