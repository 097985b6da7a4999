package com.indiaforecast.forecast.orchestrator;

public enum FailureKind {
    /** Network error or timeout after every retry. */
    SOURCE_UNAVAILABLE,
    /** The source answered with something that could not be understood. */
    PARSE_ERROR
}
