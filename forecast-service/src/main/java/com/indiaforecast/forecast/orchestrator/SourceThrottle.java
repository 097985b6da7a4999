package com.indiaforecast.forecast.orchestrator;

import com.indiaforecast.common.model.SourceId;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps requests to the same source at least {@code minDelay} apart. Each call reserves
 * the next free slot for its source and waits until that slot, so bursts queue up instead
 * of hammering one host. Different sources never wait for each other.
 */
public class SourceThrottle {

    private final Duration minDelay;
    private final ConcurrentHashMap<SourceId, Long> nextSlotNanos = new ConcurrentHashMap<>();

    public SourceThrottle(Duration minDelay) {
        this.minDelay = minDelay;
    }

    public <T> Mono<T> throttle(SourceId source, Mono<T> call) {
        if (minDelay.isZero()) {
            return call;
        }
        return Mono.defer(() -> {
            long waitNanos = reserve(source, System.nanoTime());
            return waitNanos <= 0 ? call : Mono.delay(Duration.ofNanos(waitNanos)).then(call);
        });
    }

    /** Reserves the next slot for {@code source} and returns how long the caller must wait for it. */
    long reserve(SourceId source, long nowNanos) {
        long[] slot = new long[1];
        nextSlotNanos.compute(source, (s, next) -> {
            long start = next == null ? nowNanos : Math.max(nowNanos, next);
            slot[0] = start;
            return start + minDelay.toNanos();
        });
        return slot[0] - nowNanos;
    }
}
