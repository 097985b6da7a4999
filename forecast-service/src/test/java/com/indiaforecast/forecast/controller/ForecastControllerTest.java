package com.indiaforecast.forecast.controller;

import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.support.CatalogStack;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class ForecastControllerTest {

    private final CatalogStack stack = new CatalogStack();
    private final WebTestClient client = WebTestClient
        .bindToController(new ForecastController(stack.service, stack.registry, stack.cache))
        .build();

    @Test
    void accuracyReturnsClassifiedForecasts() {
        client.get()
            .uri("/api/v1/forecasts/accuracy?forecastYear=1975&targetYear=2000&sectors=Economy&sources=Planning Commission")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.toleranceBand").isEqualTo("MODERATE")
            .jsonPath("$.results.ECONOMY[0].status").isEqualTo("LATE")
            .jsonPath("$.results.ECONOMY[0].actual.source").isEqualTo("MOSPI")
            .jsonPath("$.statistics.statusCounts.LATE").isEqualTo(1)
            .jsonPath("$.failures").isEmpty();
    }

    @Test
    void likelihoodReturnsOutlookCounts() {
        client.get()
            .uri("/api/v1/forecasts/likelihood?targetYear=2030&sectors=energy&band=loose")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.assessments.ENERGY[0].prediction.metric").isEqualTo("Renewable Energy Capacity")
            .jsonPath("$.assessments.ENERGY[0].outlook").isEqualTo("LATE_RISK")
            .jsonPath("$.outlookCounts.LATE_RISK").isEqualTo(1)
            .jsonPath("$.bySector.ENERGY.outlook").isEqualTo("LATE_RISK")
            .jsonPath("$.bySector.ENERGY.predictions").isEqualTo(1);
    }

    @Test
    void trendReturnsOneSeriesPerSector() {
        client.get().uri("/api/v1/forecasts/trend?fromYear=2000&toYear=2030&sectors=Economy")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.step").isEqualTo(5)
            .jsonPath("$.series.ECONOMY.length()").isEqualTo(7)
            .jsonPath("$.series.ECONOMY[0].year").isEqualTo(2000)
            .jsonPath("$.series.ECONOMY[0].actuals[0].source").isEqualTo("MOSPI");
    }

    @Test
    void nonPositiveTrendStepIsBadRequest() {
        client.get().uri("/api/v1/forecasts/trend?fromYear=2000&toYear=2030&step=0")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void sourcesListsTheWholeRegistry() {
        client.get().uri("/api/v1/forecasts/sources")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(SourceId.values().length)
            .jsonPath("$[0].id").isEqualTo("RBI");
    }

    @Test
    void unknownSectorIsBadRequest() {
        client.get().uri("/api/v1/forecasts/accuracy?forecastYear=1975&targetYear=2000&sectors=Space")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Unknown sector: Space");
    }

    @Test
    void reversedYearsAreBadRequest() {
        client.get().uri("/api/v1/forecasts/accuracy?forecastYear=2000&targetYear=1975")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void missingYearIsBadRequest() {
        client.get().uri("/api/v1/forecasts/likelihood")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void clearingTheCacheReportsHowManyEntriesWentAway() {
        client.get().uri("/api/v1/forecasts/likelihood?targetYear=2030&sectors=Energy").exchange().expectStatus().isOk();
        int before = stack.cache.size();
        assertTrue(before > 0);

        client.delete().uri("/api/v1/forecasts/cache")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.cleared").isEqualTo(before);
        assertEquals(0, stack.cache.size());
    }

    @Test
    void healthIsOk() {
        client.get().uri("/api/v1/forecasts/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    void blankListsMeanEverything() {
        assertEquals(EnumSet.allOf(Sector.class), ForecastController.parseSectors(" "));
        assertEquals(EnumSet.allOf(SourceId.class), ForecastController.parseSources(null));
        assertEquals(EnumSet.of(SourceId.RBI, SourceId.MOSPI), ForecastController.parseSources("mospi, RBI"));
    }
}
