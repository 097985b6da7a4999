package com.indiaforecast.forecast.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Reactive in-memory memoization for source fetches, keyed by {@link CacheKeys}.
 *
 * <p><strong>Fetch once, serve many:</strong> a fresh entry is served without touching the
 * source. On a miss the fetch is started exactly once per key; concurrent callers for the
 * same key join the in-flight {@link Sinks.One} instead of starting their own.
 *
 * <p>The fetch is subscribed by the cache itself, not by the caller, so it runs to
 * completion and populates the entry even if every caller cancels. Failures reach all
 * waiting callers and are never stored.
 *
 * <p>TTL is passed per call (see {@link CacheTtlPolicy}). An expired entry is never served
 * by {@link #getOrFetch}; it stays in place until a successful refresh replaces it, so a
 * failed refresh leaves it untouched and {@link #peek} can still offer it as a fallback.
 * {@link #get} evicts expired entries lazily. "Now" comes from the injected {@link Clock}.
 */
public class FetchCache {

    private static final Logger log = LoggerFactory.getLogger(FetchCache.class);

    private final ConcurrentHashMap<String, CachedEntry> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Sinks.One<Object>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;

    public FetchCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the cached value for {@code key} if younger than {@code ttl}, otherwise runs
     * {@code fetchFn} (once, however many callers race) and caches what it produces.
     * An empty result is cached as absence and replayed as an empty {@code Mono}.
     */
    public <T> Mono<T> getOrFetch(String key, Duration ttl, Supplier<Mono<T>> fetchFn) {
        return getOrFetch(key, ttl, ttl, fetchFn);
    }

    /**
     * As {@link #getOrFetch(String, Duration, Supplier)}, but a cached absence stays fresh
     * only for {@code absentTtl}.
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> getOrFetch(String key, Duration ttl, Duration absentTtl, Supplier<Mono<T>> fetchFn) {
        return Mono.defer(() -> {
            CachedEntry entry = store.get(key);
            if (entry != null && !isExpired(entry, entry.value() == null ? absentTtl : ttl)) {
                log.debug("CACHE_HIT key={}", key);
                return Mono.justOrEmpty((T) entry.value());
            }

            Sinks.One<Object> created = Sinks.one();
            Sinks.One<Object> existing = inFlight.putIfAbsent(key, created);
            if (existing != null) {
                log.debug("CACHE_JOIN key={}", key);
                return (Mono<T>) existing.asMono();
            }

            log.info("CACHE_MISS key={}", key);
            start(key, created, fetchFn);
            return (Mono<T>) created.asMono();
        });
    }

    /**
     * Returns the entry for {@code key} if present and fresh. An expired entry is evicted
     * and reported as absent.
     */
    public Optional<CachedEntry> get(String key, Duration ttl) {
        CachedEntry entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, ttl)) {
            store.remove(key, entry);
            log.debug("CACHE_EXPIRED key={} fetchedAt={}", key, entry.fetchedAt());
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /** Whatever is stored for {@code key}, fresh or not. Never triggers a fetch. */
    public Optional<CachedEntry> peek(String key) {
        return Optional.ofNullable(store.get(key));
    }

    public boolean isExpired(CachedEntry entry, Duration ttl) {
        return !clock.instant().isBefore(entry.fetchedAt().plus(ttl));
    }

    public void invalidate(String key) {
        if (store.remove(key) != null) {
            log.info("CACHE_INVALIDATE key={}", key);
        }
    }

    public void clear() {
        int size = store.size();
        store.clear();
        log.info("CACHE_CLEAR entries={}", size);
    }

    public int size() {
        return store.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    // ── fetch ────────────────────────────────────────────────────────────────

    private <T> void start(String key, Sinks.One<Object> sink, Supplier<Mono<T>> fetchFn) {
        Mono<T> source;
        try {
            source = fetchFn.get();
        } catch (RuntimeException e) {
            source = Mono.error(e);
        }
        source
            .map(Optional::<Object>of)
            .defaultIfEmpty(Optional.empty())
            .subscribe(
                result -> {
                    Object value = result.orElse(null);
                    store.put(key, new CachedEntry(key, value, clock.instant()));
                    inFlight.remove(key, sink);
                    log.info("CACHE_REFRESH key={} empty={}", key, value == null);
                    if (value == null) {
                        sink.tryEmitEmpty();
                    } else {
                        sink.tryEmitValue(value);
                    }
                },
                error -> {
                    inFlight.remove(key, sink);
                    log.debug("CACHE_FETCH_FAILED key={} reason={}", key, error.toString());
                    sink.tryEmitError(error);
                });
    }
}
