package com.indiaforecast.forecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.indiaforecast.common.classification.ClassificationEngine;
import com.indiaforecast.common.classification.ToleranceBands;
import com.indiaforecast.common.likelihood.LikelihoodEngine;
import com.indiaforecast.common.likelihood.LikelihoodSettings;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.cache.CacheTtlPolicy;
import com.indiaforecast.forecast.cache.FetchCache;
import com.indiaforecast.forecast.cache.YearAwareTtlPolicy;
import com.indiaforecast.forecast.orchestrator.RequestGate;
import com.indiaforecast.forecast.orchestrator.SourceThrottle;
import com.indiaforecast.forecast.registry.SourceRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Configuration
public class ForecastConfig {

    // ── forecast.fetch / forecast.cache ─────────────────────────────────────
    @Value("${forecast.fetch.request-timeout:PT30S}")
    private Duration requestTimeout;

    @Value("${forecast.fetch.max-retries:3}")
    private int maxRetries;

    @Value("${forecast.fetch.initial-backoff:PT0.5S}")
    private Duration initialBackoff;

    @Value("${forecast.fetch.inter-request-delay:PT1S}")
    private Duration interRequestDelay;

    @Value("${forecast.fetch.max-concurrent-requests:4}")
    private int maxConcurrentRequests;

    @Value("${forecast.cache.live-ttl:PT1H}")
    private Duration liveTtl;

    @Value("${forecast.cache.historical-ttl:P3650D}")
    private Duration historicalTtl;

    // ── forecast.classification / forecast.likelihood ───────────────────────
    @Value("${forecast.classification.strict:0.05}")
    private double strictBand;

    @Value("${forecast.classification.moderate:0.15}")
    private double moderateBand;

    @Value("${forecast.classification.loose:0.25}")
    private double looseBand;

    @Value("${forecast.likelihood.steepness:5.0}")
    private double steepness;

    @Value("${forecast.likelihood.min-sample-size:5}")
    private int minSampleSize;

    @Value("${forecast.likelihood.outlook-margin:0.10}")
    private double outlookMargin;

    @Value("${forecast.likelihood.calibration-windows:1975:2000,1997:2002,2002:2007,2007:2012,2012:2017}")
    private String calibrationWindows;

    // ── sources.<id>.base-url ───────────────────────────────────────────────
    @Value("${sources.world-bank.base-url:}")
    private String worldBankUrl;

    @Value("${sources.rbi.base-url:}")
    private String rbiUrl;

    @Value("${sources.economic-times.base-url:}")
    private String economicTimesUrl;

    @Value("${sources.the-hindu.base-url:}")
    private String theHinduUrl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FetchSettings fetchSettings() {
        return new FetchSettings(requestTimeout, maxRetries, initialBackoff, interRequestDelay,
            maxConcurrentRequests, liveTtl, historicalTtl);
    }

    @Bean
    public CalibrationSettings calibrationSettings() {
        return new CalibrationSettings(CalibrationWindow.parseList(calibrationWindows));
    }

    @Bean
    public SourceRegistry sourceRegistry() {
        Map<SourceId, String> overrides = new EnumMap<>(SourceId.class);
        overrides.put(SourceId.WORLD_BANK, worldBankUrl);
        overrides.put(SourceId.RBI, rbiUrl);
        overrides.put(SourceId.ECONOMIC_TIMES, economicTimesUrl);
        overrides.put(SourceId.THE_HINDU, theHinduUrl);
        return SourceRegistry.withEndpoints(overrides);
    }

    @Bean
    public CacheTtlPolicy cacheTtlPolicy(FetchSettings settings, Clock clock) {
        return new YearAwareTtlPolicy(settings.liveTtl(), settings.historicalTtl(), clock);
    }

    @Bean
    public FetchCache fetchCache(Clock clock) {
        return new FetchCache(clock);
    }

    @Bean
    public SourceThrottle sourceThrottle(FetchSettings settings) {
        return new SourceThrottle(settings.interRequestDelay());
    }

    /** One gate for the whole process; every fan-out draws from the same permits. */
    @Bean
    public RequestGate requestGate(FetchSettings settings) {
        return new RequestGate(settings.maxConcurrentRequests());
    }

    @Bean
    public ClassificationEngine classificationEngine() {
        return new ClassificationEngine(new ToleranceBands(strictBand, moderateBand, looseBand));
    }

    @Bean
    public LikelihoodEngine likelihoodEngine(Clock clock) {
        return new LikelihoodEngine(new LikelihoodSettings(steepness, minSampleSize, outlookMargin, Map.of()), clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
