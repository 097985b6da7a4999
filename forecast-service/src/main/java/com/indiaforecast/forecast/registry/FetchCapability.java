package com.indiaforecast.forecast.registry;

import java.util.Locale;

/**
 * The three fetch operations a source may support. The lower-case name doubles as the
 * operation segment of cache keys.
 */
public enum FetchCapability {
    HISTORICAL,
    ACTUALS,
    CURRENT;

    public String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
