package com.indiaforecast.forecast.cache;

import com.indiaforecast.common.model.Query;

import java.time.Duration;

/** Decides how long a fetch result for a given query stays fresh. */
@FunctionalInterface
public interface CacheTtlPolicy {
    Duration ttlFor(Query query);

    /** How long a "no data" answer for {@code query} stays fresh. */
    default Duration absenceTtlFor(Query query) {
        return ttlFor(query);
    }
}
