package com.indiaforecast.forecast.controller;

import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.common.model.ToleranceBand;
import com.indiaforecast.forecast.cache.FetchCache;
import com.indiaforecast.forecast.registry.SourceDescriptor;
import com.indiaforecast.forecast.registry.SourceRegistry;
import com.indiaforecast.forecast.service.AccuracyReport;
import com.indiaforecast.forecast.service.ForecastAnalysisService;
import com.indiaforecast.forecast.service.LikelihoodReport;
import com.indiaforecast.forecast.service.TrendReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/forecasts")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final ForecastAnalysisService analysisService;
    private final SourceRegistry registry;
    private final FetchCache cache;

    public ForecastController(ForecastAnalysisService analysisService, SourceRegistry registry, FetchCache cache) {
        this.analysisService = analysisService;
        this.registry        = registry;
        this.cache           = cache;
    }

    /** {@code GET /accuracy?forecastYear=1975&targetYear=2000&sectors=Economy,Energy&band=moderate} */
    @GetMapping("/accuracy")
    public Mono<ResponseEntity<AccuracyReport>> accuracy(
            @RequestParam int forecastYear,
            @RequestParam int targetYear,
            @RequestParam(required = false) String sectors,
            @RequestParam(required = false) String sources,
            @RequestParam(required = false) String band) {
        return Mono.defer(() -> analysisService.evaluateForecasts(forecastYear, targetYear,
                parseSectors(sectors), parseSources(sources), ToleranceBand.fromLabel(band)))
            .map(ResponseEntity::ok);
    }

    /** {@code GET /likelihood?targetYear=2030&sectors=Energy} */
    @GetMapping("/likelihood")
    public Mono<ResponseEntity<LikelihoodReport>> likelihood(
            @RequestParam int targetYear,
            @RequestParam(required = false) String sectors,
            @RequestParam(required = false) String sources,
            @RequestParam(required = false) String band) {
        return Mono.defer(() -> analysisService.assessLikelihood(targetYear,
                parseSectors(sectors), parseSources(sources), ToleranceBand.fromLabel(band)))
            .map(ResponseEntity::ok);
    }

    /** {@code GET /trend?fromYear=2000&toYear=2030&step=5&sectors=Economy,Energy} */
    @GetMapping("/trend")
    public Mono<ResponseEntity<TrendReport>> trend(
            @RequestParam int fromYear,
            @RequestParam int toYear,
            @RequestParam(defaultValue = "5") int step,
            @RequestParam(required = false) String sectors) {
        return Mono.defer(() -> analysisService.trend(fromYear, toYear, step, parseSectors(sectors)))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/sources")
    public ResponseEntity<List<SourceDescriptor>> sources() {
        return ResponseEntity.ok(registry.all());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Integer>> clearCache() {
        int cleared = cache.size();
        cache.clear();
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    // ── request parsing ──────────────────────────────────────────────────────

    /** Comma-separated labels; absent or blank means every sector. */
    static Set<Sector> parseSectors(String csv) {
        if (csv == null || csv.isBlank()) {
            return EnumSet.allOf(Sector.class);
        }
        return Arrays.stream(csv.split(","))
            .filter(s -> !s.isBlank())
            .map(Sector::fromLabel)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Sector.class)));
    }

    /** Comma-separated labels; absent or blank means every registered source. */
    static Set<SourceId> parseSources(String csv) {
        if (csv == null || csv.isBlank()) {
            return EnumSet.allOf(SourceId.class);
        }
        return Arrays.stream(csv.split(","))
            .filter(s -> !s.isBlank())
            .map(SourceId::fromLabel)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(SourceId.class)));
    }
}
