package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.model.Measurement;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionExtractorTest {

    @Test
    void readsPercentProjection() {
        ProjectionExtractor.Projection p = ProjectionExtractor
            .projection("GDP growth projected at 7.2% for 2025, says central bank").orElseThrow();

        assertEquals("GDP growth", p.metric());
        assertEquals(Measurement.of(7.2, "%"), p.value());
        assertEquals(2025, p.targetYear());
    }

    @Test
    void readsUnitWordAndThousandsSeparator() {
        ProjectionExtractor.Projection p = ProjectionExtractor
            .projection("India's highway network expected to reach 2,00,000 km by 2025").orElseThrow();

        assertEquals("Highway network", p.metric());
        assertEquals(200000, p.value().value(), 1e-9);
        assertEquals("km", p.value().unit());
    }

    @Test
    void readsProgressAgainstTarget() {
        ProjectionExtractor.Progress p = ProjectionExtractor.progress(
            "Renewable energy capacity reaches 118 GW against 450 GW target for 2030, set in 2019").orElseThrow();

        assertEquals("Renewable energy capacity", p.metric());
        assertEquals(Measurement.of(118, "gw"), p.progress());
        assertEquals(Measurement.of(450, "gw"), p.target());
        assertEquals(2030, p.targetYear());
        assertEquals(OptionalInt.of(2019), p.announcementYear());
    }

    @Test
    void progressWithoutAnnouncementYear() {
        ProjectionExtractor.Progress p = ProjectionExtractor.progress(
            "Solar capacity touches 82 GW towards a 280 GW target by 2030").orElseThrow();
        assertTrue(p.announcementYear().isEmpty());
    }

    @Test
    void unrelatedTextYieldsNothing() {
        assertTrue(ProjectionExtractor.projection("Monsoon arrives early in Kerala").isEmpty());
        assertTrue(ProjectionExtractor.progress("Monsoon arrives early in Kerala").isEmpty());
        assertTrue(ProjectionExtractor.projection(null).isEmpty());
    }
}
