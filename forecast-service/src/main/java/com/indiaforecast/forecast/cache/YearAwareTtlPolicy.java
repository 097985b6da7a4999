package com.indiaforecast.forecast.cache;

import com.indiaforecast.common.model.Query;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Past years do not change, so queries that end before the current year get the long
 * historical TTL; anything touching this year or later gets the live TTL.
 *
 * <p>Absence always gets the live TTL: figures for recent years are often published late.
 */
public class YearAwareTtlPolicy implements CacheTtlPolicy {

    private final Duration liveTtl;
    private final Duration historicalTtl;
    private final Clock clock;

    public YearAwareTtlPolicy(Duration liveTtl, Duration historicalTtl, Clock clock) {
        this.liveTtl       = liveTtl;
        this.historicalTtl = historicalTtl;
        this.clock         = clock;
    }

    @Override
    public Duration ttlFor(Query query) {
        int currentYear = LocalDate.now(clock).getYear();
        return query.toYear() >= currentYear ? liveTtl : historicalTtl;
    }

    @Override
    public Duration absenceTtlFor(Query query) {
        return liveTtl;
    }
}
