package com.indiaforecast.forecast.orchestrator;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Query;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.cache.CacheKeys;
import com.indiaforecast.forecast.cache.CacheTtlPolicy;
import com.indiaforecast.forecast.cache.FetchCache;
import com.indiaforecast.forecast.fetcher.SourceFetcher;
import com.indiaforecast.forecast.fetcher.SourceFetchers;
import com.indiaforecast.forecast.registry.FetchCapability;
import com.indiaforecast.forecast.registry.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans a logical query (sectors x sources x years) out to the source fetchers.
 *
 * <p>Every (sector, source) call goes through {@link FetchCache}; only cache misses reach
 * {@link RequestGate} and {@link SourceThrottle}, so cache hits never take a permit. The
 * gate is shared by every query, so its cap holds across concurrent requests. Years a
 * fetcher does not cover are skipped without a call. An empty answer is cached as absence
 * under {@link CacheTtlPolicy#absenceTtlFor}. A failing pair becomes a {@link FetchFailure}
 * in the batch; it never fails the whole query.
 *
 * <p>Results are ordered by sector, then source, in enum declaration order, regardless of
 * the order in which the caller listed them or the order in which fetches completed.
 */
@Service
public class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final SourceRegistry registry;
    private final SourceFetchers fetchers;
    private final FetchCache cache;
    private final CacheTtlPolicy ttlPolicy;
    private final SourceThrottle throttle;
    private final RequestGate gate;
    private final Clock clock;

    public FetchOrchestrator(SourceRegistry registry, SourceFetchers fetchers, FetchCache cache,
                             CacheTtlPolicy ttlPolicy, SourceThrottle throttle, RequestGate gate, Clock clock) {
        this.registry  = registry;
        this.fetchers  = fetchers;
        this.cache     = cache;
        this.ttlPolicy = ttlPolicy;
        this.throttle  = throttle;
        this.gate      = gate;
        this.clock     = clock;
    }

    public Mono<FetchBatch<ForecastRecord>> fetchHistoricalForecasts(int forecastYear, int targetYear,
                                                                     Collection<Sector> sectors,
                                                                     Collection<SourceId> sources) {
        return fanOut(FetchCapability.HISTORICAL, sectors, sources, forecastYear, targetYear,
            (fetcher, sector) -> fetcher.fetchHistorical(forecastYear, targetYear, sector));
    }

    /** Queries every registered source that publishes actuals. */
    public Mono<FetchBatch<ActualRecord>> fetchActualOutcomes(int targetYear, Collection<Sector> sectors) {
        return fanOut(FetchCapability.ACTUALS, sectors, registry.withCapability(FetchCapability.ACTUALS),
            targetYear, targetYear,
            (fetcher, sector) -> fetcher.fetchActual(targetYear, sector).map(List::of));
    }

    public Mono<FetchBatch<Prediction>> fetchCurrentPredictions(int targetYear, Collection<Sector> sectors,
                                                                Collection<SourceId> sources) {
        return fanOut(FetchCapability.CURRENT, sectors, sources, targetYear, targetYear,
            (fetcher, sector) -> fetcher.fetchCurrent(targetYear, sector).map(List::of));
    }

    /**
     * Per-sector year series from {@code fromYear} to {@code toYear} every {@code step}
     * years: actuals for years up to the current one, open targets for later years. Each
     * year is fetched pair by pair through the cache like any other query.
     */
    public Mono<FetchBatch<TrendPoint>> fetchTrend(int fromYear, int toYear, int step, Collection<Sector> sectors) {
        if (toYear < fromYear) {
            return Mono.error(new IllegalArgumentException(
                "toYear " + toYear + " precedes fromYear " + fromYear));
        }
        if (step < 1) {
            return Mono.error(new IllegalArgumentException("step must be >= 1, got " + step));
        }
        Set<Sector> orderedSectors = sectors.isEmpty() ? Set.of() : EnumSet.copyOf(sectors);
        int currentYear = LocalDate.now(clock).getYear();
        List<Integer> years = new ArrayList<>();
        for (int year = fromYear; year <= toYear; year += step) {
            years.add(year);
        }

        return Flux.fromIterable(years)
            .concatMap(year -> year <= currentYear
                ? fetchActualOutcomes(year, orderedSectors).map(b -> trendYear(year, b, null))
                : fetchCurrentPredictions(year, orderedSectors, registry.withCapability(FetchCapability.CURRENT))
                    .map(b -> trendYear(year, null, b)))
            .collectList()
            .map(slices -> {
                Map<Sector, List<TrendPoint>> bySector = new EnumMap<>(Sector.class);
                orderedSectors.forEach(s -> bySector.put(s, new ArrayList<>()));
                List<FetchFailure> failures = new ArrayList<>();
                for (FetchBatch<TrendPoint> slice : slices) {
                    slice.bySector().forEach((sector, points) -> bySector.get(sector).addAll(points));
                    failures.addAll(slice.failures());
                }
                log.info("Trend fetched. years={}-{} step={} points={} failures={}",
                    fromYear, toYear, step, years.size(), failures.size());
                return new FetchBatch<>(bySector, failures);
            });
    }

    private static FetchBatch<TrendPoint> trendYear(int year, FetchBatch<ActualRecord> actuals,
                                                    FetchBatch<Prediction> targets) {
        FetchBatch<?> source = actuals != null ? actuals : targets;
        Map<Sector, List<TrendPoint>> bySector = new EnumMap<>(Sector.class);
        for (Sector sector : source.bySector().keySet()) {
            bySector.put(sector, List.of(new TrendPoint(year,
                actuals != null ? actuals.forSector(sector) : List.of(),
                targets != null ? targets.forSector(sector) : List.of())));
        }
        return new FetchBatch<>(bySector, source.failures());
    }

    // ── fan-out ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface PairCall<T> {
        Mono<List<T>> call(SourceFetcher fetcher, Sector sector);
    }

    private record Pair(Sector sector, SourceId source, SourceFetcher fetcher) {}

    private record PairOutcome<T>(Pair pair, List<T> records, FetchFailure failure) {}

    private <T> Mono<FetchBatch<T>> fanOut(FetchCapability operation, Collection<Sector> sectors,
                                           Collection<SourceId> sources, int fromYear, int toYear,
                                           PairCall<T> call) {
        Set<Sector> orderedSectors = sectors.isEmpty() ? Set.of() : EnumSet.copyOf(sectors);
        List<Pair> pairs = pairs(operation, orderedSectors, sources, fromYear);
        if (pairs.isEmpty()) {
            return Mono.just(FetchBatch.empty(orderedSectors));
        }
        log.info("Fetch started. op={} years={}-{} sectors={} pairs={}",
            operation.operationName(), fromYear, toYear, orderedSectors.size(), pairs.size());

        return Flux.fromIterable(pairs)
            .flatMapSequential(pair -> fetchPair(operation, pair, fromYear, toYear, call), gate.maxConcurrent())
            .collectList()
            .map(outcomes -> merge(operation, orderedSectors, outcomes));
    }

    private List<Pair> pairs(FetchCapability operation, Set<Sector> sectors, Collection<SourceId> sources,
                             int year) {
        Set<SourceId> orderedSources = sources.isEmpty() ? Set.of() : EnumSet.copyOf(sources);
        List<Pair> pairs = new ArrayList<>();
        for (SourceId source : orderedSources) {
            if (!registry.supports(source, operation)) {
                log.debug("Skipping source={} op={}: capability not offered", source, operation.operationName());
                continue;
            }
            SourceFetcher fetcher = fetchers.forSource(source).orElse(null);
            if (fetcher == null) {
                log.debug("Skipping source={} op={}: no fetcher registered", source, operation.operationName());
                continue;
            }
            if (!fetcher.covers(year)) {
                log.debug("Skipping source={} op={}: year {} not covered", source, operation.operationName(), year);
                continue;
            }
            for (Sector sector : sectors) {
                pairs.add(new Pair(sector, source, fetcher));
            }
        }
        pairs.sort((a, b) -> a.sector() != b.sector()
            ? a.sector().compareTo(b.sector())
            : a.source().compareTo(b.source()));
        return pairs;
    }

    private <T> Mono<PairOutcome<T>> fetchPair(FetchCapability operation, Pair pair, int fromYear, int toYear,
                                               PairCall<T> call) {
        Query query = Query.single(pair.sector(), pair.source(), fromYear, toYear);
        String key = CacheKeys.derive(operation.operationName(), query);
        Duration ttl = ttlPolicy.ttlFor(query);
        Duration absentTtl = ttlPolicy.absenceTtlFor(query);

        return cache.<List<T>>getOrFetch(key, ttl, absentTtl,
                () -> gate.submit(throttle.throttle(pair.source(), call.call(pair.fetcher(), pair.sector())))
                    .filter(records -> !records.isEmpty()))
            .defaultIfEmpty(List.of())
            .map(records -> new PairOutcome<T>(pair, records, null))
            .onErrorResume(e -> {
                FetchFailure failure = FetchFailure.of(pair.sector(), pair.source(), operation, e);
                log.warn("FETCH_FAILED op={} source={} sector={} kind={} reason={}",
                    operation.operationName(), pair.source(), pair.sector(), failure.kind(), failure.message());
                return Mono.just(new PairOutcome<T>(pair, List.of(), failure));
            });
    }

    private <T> FetchBatch<T> merge(FetchCapability operation, Set<Sector> sectors, List<PairOutcome<T>> outcomes) {
        Map<Sector, List<T>> bySector = new EnumMap<>(Sector.class);
        sectors.forEach(s -> bySector.put(s, new ArrayList<>()));
        List<FetchFailure> failures = new ArrayList<>();
        int recordCount = 0;
        for (PairOutcome<T> outcome : outcomes) {
            bySector.get(outcome.pair().sector()).addAll(outcome.records());
            recordCount += outcome.records().size();
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            }
        }
        log.info("Fetch complete. op={} pairs={} records={} failures={}",
            operation.operationName(), outcomes.size(), recordCount, failures.size());
        return new FetchBatch<>(bySector, failures);
    }
}
