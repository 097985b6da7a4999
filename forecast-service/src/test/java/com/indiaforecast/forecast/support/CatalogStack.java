package com.indiaforecast.forecast.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.indiaforecast.common.classification.ClassificationEngine;
import com.indiaforecast.common.classification.ToleranceBands;
import com.indiaforecast.common.likelihood.LikelihoodEngine;
import com.indiaforecast.common.likelihood.LikelihoodSettings;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.cache.FetchCache;
import com.indiaforecast.forecast.cache.YearAwareTtlPolicy;
import com.indiaforecast.forecast.config.CalibrationSettings;
import com.indiaforecast.forecast.config.CalibrationWindow;
import com.indiaforecast.forecast.config.FetchSettings;
import com.indiaforecast.forecast.fetcher.CatalogFetcher;
import com.indiaforecast.forecast.fetcher.SourceFetcher;
import com.indiaforecast.forecast.fetcher.SourceFetchers;
import com.indiaforecast.forecast.orchestrator.FetchOrchestrator;
import com.indiaforecast.forecast.orchestrator.RequestGate;
import com.indiaforecast.forecast.orchestrator.SourceThrottle;
import com.indiaforecast.forecast.registry.SourceRegistry;
import com.indiaforecast.forecast.service.ForecastAnalysisService;
import org.springframework.core.io.ClassPathResource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The real service wired offline: bundled catalogs only, no network fetchers, clock fixed
 * at 2024-06-30.
 */
public final class CatalogStack {

    public static final String DEFAULT_WINDOWS = "1975:2000,1997:2002,2002:2007,2007:2012,2012:2017";

    private static final FetchSettings SETTINGS = new FetchSettings(Duration.ofSeconds(1), 0, Duration.ofMillis(10),
        Duration.ZERO, 4, Duration.ofHours(1), Duration.ofDays(3650));

    public final MutableClock clock = MutableClock.at("2024-06-30T00:00:00Z");
    public final SourceRegistry registry = SourceRegistry.defaults();
    public final FetchCache cache = new FetchCache(clock);
    public final ForecastAnalysisService service;

    public CatalogStack(SourceFetcher... extraFetchers) {
        this(SETTINGS.maxConcurrentRequests(), extraFetchers);
    }

    /** Same stack with a different process-wide cap on simultaneous source calls. */
    public static CatalogStack withConcurrency(int maxConcurrent, SourceFetcher... extraFetchers) {
        return new CatalogStack(maxConcurrent, extraFetchers);
    }

    private CatalogStack(int maxConcurrent, SourceFetcher[] extraFetchers) {
        ObjectMapper objectMapper = new ObjectMapper();
        List<SourceFetcher> fetchers = new ArrayList<>(List.of(
            new CatalogFetcher(SourceId.PLANNING_COMMISSION, new ClassPathResource("catalog/planning-commission.json"), objectMapper),
            new CatalogFetcher(SourceId.NITI_AAYOG, new ClassPathResource("catalog/niti-aayog.json"), objectMapper),
            new CatalogFetcher(SourceId.PIB, new ClassPathResource("catalog/pib.json"), objectMapper),
            new CatalogFetcher(SourceId.MOSPI, new ClassPathResource("catalog/mospi.json"), objectMapper)));
        fetchers.addAll(List.of(extraFetchers));

        FetchOrchestrator orchestrator = new FetchOrchestrator(registry, new SourceFetchers(fetchers), cache,
            new YearAwareTtlPolicy(SETTINGS.liveTtl(), SETTINGS.historicalTtl(), clock),
            new SourceThrottle(Duration.ZERO), new RequestGate(maxConcurrent), clock);

        this.service = new ForecastAnalysisService(orchestrator,
            new ClassificationEngine(ToleranceBands.defaults()),
            new LikelihoodEngine(LikelihoodSettings.defaults(), clock),
            registry,
            new CalibrationSettings(CalibrationWindow.parseList(DEFAULT_WINDOWS)));
    }
}
