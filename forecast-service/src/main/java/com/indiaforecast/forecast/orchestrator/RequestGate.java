package com.indiaforecast.forecast.orchestrator;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Process-wide cap on simultaneous outbound source calls, shared by every fan-out.
 * A call waits for a permit before it is subscribed and returns the permit when it
 * terminates or is cancelled. Waiters are served in arrival order.
 */
public class RequestGate {

    private final int maxConcurrent;
    private final Deque<Sinks.Empty<Void>> waiters = new ArrayDeque<>();
    private int active;

    public RequestGate(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public synchronized int active() {
        return active;
    }

    public <T> Mono<T> submit(Mono<T> call) {
        return acquire().then(Mono.defer(() -> call.doFinally(signal -> release())));
    }

    private Mono<Void> acquire() {
        return Mono.defer(() -> {
            Sinks.Empty<Void> ticket;
            synchronized (this) {
                if (active < maxConcurrent) {
                    active++;
                    return Mono.<Void>empty();
                }
                ticket = Sinks.empty();
                waiters.addLast(ticket);
            }
            return ticket.asMono().doOnCancel(() -> abandon(ticket));
        });
    }

    private void abandon(Sinks.Empty<Void> ticket) {
        boolean stillWaiting;
        synchronized (this) {
            stillWaiting = waiters.remove(ticket);
        }
        if (!stillWaiting) {
            // permit was handed over just as the caller went away
            release();
        }
    }

    private void release() {
        Sinks.Empty<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                active--;
                return;
            }
        }
        next.tryEmitEmpty();
    }
}
