package com.indiaforecast.common.classification;

import com.indiaforecast.common.model.ClassificationResult;
import com.indiaforecast.common.model.ClassificationStatus;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Measurement;
import com.indiaforecast.common.model.RawConfidence;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.common.model.ToleranceBand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoricalAccuracyStatsTest {

    private static ClassificationResult result(Sector sector, ClassificationStatus status, Double deviation) {
        ForecastRecord forecast = new ForecastRecord("metric", Measurement.of(1, "u"), SourceId.RBI, sector,
            2000, 2010, "", RawConfidence.LOW);
        return new ClassificationResult(forecast, null, status, deviation, ToleranceBand.MODERATE);
    }

    @Test
    @DisplayName("accuracy rate counts EARLY and ON_TIME over resolved forecasts only")
    void accuracyRate() {
        HistoricalAccuracyStats stats = HistoricalAccuracyStats.of(List.of(
            result(Sector.ENERGY, ClassificationStatus.ON_TIME, 0.02),
            result(Sector.ENERGY, ClassificationStatus.EARLY, 0.30),
            result(Sector.ENERGY, ClassificationStatus.LATE, -0.40),
            result(Sector.ENERGY, ClassificationStatus.LATE, -0.20),
            result(Sector.ENERGY, ClassificationStatus.UNRESOLVED, null)));

        SectorAccuracy energy = stats.forSector(Sector.ENERGY);
        assertEquals(4, energy.sampleSize());
        assertEquals(1, energy.unresolved());
        assertEquals(0.5, energy.accuracyRate(), 1e-9);
        assertEquals(0.23, energy.meanAbsoluteDeviation(), 1e-9);
    }

    @Test
    @DisplayName("overall status counts include every status, zero-filled")
    void statusCounts() {
        HistoricalAccuracyStats stats = HistoricalAccuracyStats.of(List.of(
            result(Sector.ECONOMY, ClassificationStatus.LATE, -0.2),
            result(Sector.ENERGY, ClassificationStatus.LATE, -0.3)));

        assertEquals(2, stats.statusCounts().get(ClassificationStatus.LATE));
        assertEquals(0, stats.statusCounts().get(ClassificationStatus.EARLY));
        assertEquals(2, stats.totalResolved());
    }

    @Test
    @DisplayName("unknown sector → empty accuracy without history")
    void emptySector() {
        SectorAccuracy none = HistoricalAccuracyStats.empty().forSector(Sector.HEALTHCARE);
        assertFalse(none.hasHistory());
        assertEquals(Sector.HEALTHCARE, none.sector());
    }
}
