package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.exception.SourceUnavailableException;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.config.FetchSettings;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FetchRetrySupportTest {

    private static final FetchSettings FAST = new FetchSettings(Duration.ofMillis(100), 2, Duration.ofMillis(10),
        Duration.ZERO, 4, Duration.ofHours(1), Duration.ofDays(1));

    private final AtomicInteger attempts = new AtomicInteger();

    @Test
    void transientFailureRecoversOnRetry() {
        Mono<String> flaky = Mono.defer(() -> attempts.incrementAndGet() < 2
            ? Mono.error(new IOException("connection reset"))
            : Mono.just("ok"));

        assertEquals("ok", FetchRetrySupport.withRetry(flaky, SourceId.RBI, "feed", FAST).block());
        assertEquals(2, attempts.get());
    }

    @Test
    void timeoutsExhaustRetriesThenSurfaceAsUnavailable() {
        Mono<String> hanging = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.never();
        });

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
            () -> FetchRetrySupport.withRetry(hanging, SourceId.WORLD_BANK, "actual", FAST).block());

        assertEquals(3, attempts.get());
        assertEquals(SourceId.WORLD_BANK, e.getSource());
        assertTrue(e.getMessage().contains("after 3 attempts"), e.getMessage());
    }

    @Test
    void parseErrorsAreNotRetried() {
        Mono<String> malformed = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new SourceParseException(SourceId.RBI, "not RSS"));
        });

        assertThrows(SourceParseException.class,
            () -> FetchRetrySupport.withRetry(malformed, SourceId.RBI, "feed", FAST).block());
        assertEquals(1, attempts.get());
    }

    @Test
    void zeroRetriesMeansOneAttempt() {
        FetchSettings noRetry = new FetchSettings(Duration.ofMillis(100), 0, Duration.ofMillis(10),
            Duration.ZERO, 1, Duration.ofHours(1), Duration.ofDays(1));
        Mono<String> failing = Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new IOException("refused"));
        });

        assertThrows(SourceUnavailableException.class,
            () -> FetchRetrySupport.withRetry(failing, SourceId.RBI, "feed", noRetry).block());
        assertEquals(1, attempts.get());
    }
}
