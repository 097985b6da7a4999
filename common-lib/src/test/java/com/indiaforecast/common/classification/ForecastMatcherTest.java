package com.indiaforecast.common.classification;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Measurement;
import com.indiaforecast.common.model.RawConfidence;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ForecastMatcherTest {

    private static final ForecastRecord GDP_FORECAST = new ForecastRecord(
        "GDP Growth Rate", Measurement.of(6.5, "%"), SourceId.RBI, Sector.ECONOMY,
        1975, 2000, "https://rbi.org.in/archive", RawConfidence.MEDIUM);

    private static ActualRecord actual(String metric, String unit, int year, Sector sector, SourceId source) {
        return new ActualRecord(metric, Measurement.of(6.0, unit), sector, year, source, "https://example.org");
    }

    @Test
    @DisplayName("metric names match after normalisation")
    void normalisedMetricMatches() {
        assertTrue(ForecastMatcher.matchable(GDP_FORECAST,
            actual("  gdp growth-rate ", "%", 2000, Sector.ECONOMY, SourceId.WORLD_BANK)));
    }

    @Test
    @DisplayName("different year, sector or unit never matches")
    void mismatches() {
        assertFalse(ForecastMatcher.matchable(GDP_FORECAST,
            actual("GDP Growth Rate", "%", 2001, Sector.ECONOMY, SourceId.WORLD_BANK)));
        assertFalse(ForecastMatcher.matchable(GDP_FORECAST,
            actual("GDP Growth Rate", "%", 2000, Sector.ENERGY, SourceId.WORLD_BANK)));
        assertFalse(ForecastMatcher.matchable(GDP_FORECAST,
            actual("GDP Growth Rate", "usd", 2000, Sector.ECONOMY, SourceId.WORLD_BANK)));
    }

    @Test
    @DisplayName("government primary beats international agency beats news archive")
    void trustTierPreference() {
        ActualRecord news  = actual("GDP Growth Rate", "%", 2000, Sector.ECONOMY, SourceId.THE_HINDU);
        ActualRecord wb    = actual("GDP Growth Rate", "%", 2000, Sector.ECONOMY, SourceId.WORLD_BANK);
        ActualRecord mospi = actual("GDP Growth Rate", "%", 2000, Sector.ECONOMY, SourceId.MOSPI);

        assertEquals(Optional.of(mospi), ForecastMatcher.bestMatch(GDP_FORECAST, List.of(news, wb, mospi)));
        assertEquals(Optional.of(mospi), ForecastMatcher.bestMatch(GDP_FORECAST, List.of(mospi, news, wb)));
        assertEquals(Optional.of(wb), ForecastMatcher.bestMatch(GDP_FORECAST, List.of(news, wb)));
    }

    @Test
    @DisplayName("same tier ties break on source declaration order")
    void sameTierTieBreak() {
        ActualRecord rbi   = actual("GDP Growth Rate", "%", 2000, Sector.ECONOMY, SourceId.RBI);
        ActualRecord mospi = actual("GDP Growth Rate", "%", 2000, Sector.ECONOMY, SourceId.MOSPI);
        assertEquals(Optional.of(rbi), ForecastMatcher.bestMatch(GDP_FORECAST, List.of(mospi, rbi)));
    }

    @Test
    @DisplayName("no candidates → empty")
    void noCandidates() {
        assertTrue(ForecastMatcher.bestMatch(GDP_FORECAST, List.of()).isEmpty());
        assertTrue(ForecastMatcher.bestMatch(GDP_FORECAST, null).isEmpty());
    }
}
