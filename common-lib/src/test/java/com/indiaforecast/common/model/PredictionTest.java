package com.indiaforecast.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PredictionTest {

    @Test
    @DisplayName("zero target value is rejected at construction")
    void zeroTarget() {
        assertThrows(IllegalArgumentException.class, () -> new Prediction("Fiscal deficit",
            Measurement.of(0, "%"), Measurement.of(1, "%"), SourceId.RBI, Sector.ECONOMY,
            2020, 2026, "", RawConfidence.LOW));
    }

    @Test
    @DisplayName("progress must be in the target's unit")
    void unitMismatch() {
        assertThrows(IllegalArgumentException.class, () -> new Prediction("Renewable capacity",
            Measurement.of(450, "GW"), Measurement.of(118000, "MW"), SourceId.NITI_AAYOG, Sector.ENERGY,
            2019, 2030, "", RawConfidence.LOW));
    }

    @Test
    @DisplayName("units are normalised so ' GW ' equals 'gw'")
    void unitNormalisation() {
        Prediction p = new Prediction("Renewable capacity", Measurement.of(450, " GW "),
            Measurement.of(118, "gw"), SourceId.NITI_AAYOG, Sector.ENERGY, 2019, 2030, "", null);
        assertEquals("gw", p.targetValue().unit());
        assertEquals(RawConfidence.MEDIUM, p.rawConfidence());
    }

    @Test
    @DisplayName("labels resolve by constant or display name")
    void labels() {
        assertEquals(Sector.SOCIAL_DEVELOPMENT, Sector.fromLabel("social development"));
        assertEquals(SourceId.NITI_AAYOG, SourceId.fromLabel("NITI Aayog"));
        assertEquals(SourceId.WORLD_BANK, SourceId.fromLabel("world_bank"));
        assertThrows(IllegalArgumentException.class, () -> Sector.fromLabel("Space"));
    }
}
