package com.indiaforecast.forecast.orchestrator;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestGateTest {

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    private Mono<Integer> slow(int value) {
        return Mono.defer(() -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(30))
                .map(tick -> {
                    inFlight.decrementAndGet();
                    return value;
                });
        });
    }

    @Test
    void independentCallersShareTheCap() {
        RequestGate gate = new RequestGate(2);

        List<Integer> first = Flux.range(0, 3).flatMap(i -> gate.submit(slow(i))).collectList().block();
        assertEquals(3, first.size());

        List<List<Integer>> both = Flux.merge(
                Flux.range(0, 3).flatMap(i -> gate.submit(slow(i))).collectList(),
                Flux.range(3, 3).flatMap(i -> gate.submit(slow(i))).collectList())
            .collectList()
            .block(Duration.ofSeconds(5));

        assertEquals(2, both.size());
        assertEquals(2, peak.get());
        assertEquals(0, gate.active());
    }

    @Test
    void failedCallReturnsItsPermit() {
        RequestGate gate = new RequestGate(1);

        assertThrows(IllegalStateException.class,
            () -> gate.submit(Mono.error(new IllegalStateException("down"))).block());

        assertEquals("next", gate.submit(Mono.just("next")).block(Duration.ofSeconds(1)));
        assertEquals(0, gate.active());
    }

    @Test
    void waiterGetsThePermitWhenTheHolderFinishes() {
        RequestGate gate = new RequestGate(1);
        Sinks.One<String> holder = Sinks.one();
        AtomicBoolean started = new AtomicBoolean();

        Disposable held = gate.submit(holder.asMono()).subscribe();
        Mono<String> waiting = gate.submit(Mono.fromCallable(() -> {
            started.set(true);
            return "second";
        }));
        Disposable queued = waiting.subscribe();
        assertFalse(started.get());

        holder.tryEmitValue("first");
        assertTrue(started.get());
        assertEquals(0, gate.active());
        held.dispose();
        queued.dispose();
    }

    @Test
    void cancelledWaiterDoesNotLeakAPermit() {
        RequestGate gate = new RequestGate(1);
        Sinks.One<String> holder = Sinks.one();

        Disposable held = gate.submit(holder.asMono()).subscribe();
        Disposable waiter = gate.submit(Mono.just("never")).subscribe();
        waiter.dispose();

        holder.tryEmitValue("done");
        held.dispose();

        assertEquals(0, gate.active());
        assertEquals("again", gate.submit(Mono.just("again")).block(Duration.ofSeconds(1)));
    }

    @Test
    void capBelowOneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RequestGate(0));
    }
}
