package com.indiaforecast.forecast.cache;

import com.indiaforecast.common.model.Query;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class YearAwareTtlPolicyTest {

    private static final Duration LIVE       = Duration.ofHours(1);
    private static final Duration HISTORICAL = Duration.ofDays(3650);

    private final MutableClock clock = MutableClock.at("2024-06-30T00:00:00Z");
    private final YearAwareTtlPolicy policy = new YearAwareTtlPolicy(LIVE, HISTORICAL, clock);

    private static Query years(int from, int to) {
        return Query.single(Sector.ECONOMY, SourceId.WORLD_BANK, from, to);
    }

    @Test
    void pastYearsGetHistoricalTtl() {
        assertEquals(HISTORICAL, policy.ttlFor(years(1975, 2000)));
        assertEquals(HISTORICAL, policy.ttlFor(years(2023, 2023)));
    }

    @Test
    void currentOrFutureYearsGetLiveTtl() {
        assertEquals(LIVE, policy.ttlFor(years(2024, 2024)));
        assertEquals(LIVE, policy.ttlFor(years(2019, 2030)));
    }

    @Test
    void absenceAlwaysGetsLiveTtl() {
        assertEquals(LIVE, policy.absenceTtlFor(years(2023, 2023)));
        assertEquals(LIVE, policy.absenceTtlFor(years(1975, 2000)));
    }

    @Test
    void yearBoundaryFollowsTheClock() {
        clock.advance(Duration.ofDays(200));
        assertEquals(HISTORICAL, policy.ttlFor(years(2024, 2024)));
    }
}
