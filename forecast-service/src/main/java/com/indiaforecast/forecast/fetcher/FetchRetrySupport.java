package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.exception.SourceFetchException;
import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.exception.SourceUnavailableException;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.config.FetchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded timeout plus exponential-backoff retry around a single source call.
 *
 * <p>Each attempt re-subscribes {@code call}, so it must be lazy (a {@code WebClient}
 * exchange or a {@code Mono.defer}). Parse errors pass through untouched; anything else
 * that outlives the last retry becomes {@link SourceUnavailableException}.
 */
public final class FetchRetrySupport {

    private static final Logger log = LoggerFactory.getLogger(FetchRetrySupport.class);

    private FetchRetrySupport() {}

    public static <T> Mono<T> withRetry(Mono<T> call, SourceId source, String operation, FetchSettings settings) {
        Retry retry = Retry.backoff(settings.maxRetries(), settings.initialBackoff())
            .filter(e -> !(e instanceof SourceParseException))
            .doBeforeRetry(signal -> log.debug("FETCH_RETRY source={} op={} attempt={} reason={}",
                source, operation, signal.totalRetries() + 1, signal.failure().toString()))
            .onRetryExhaustedThrow((retrySpec, signal) -> new SourceUnavailableException(source,
                operation + " failed after " + (signal.totalRetries() + 1) + " attempts: "
                    + signal.failure().getMessage(), signal.failure()));

        return call
            .timeout(settings.requestTimeout())
            .retryWhen(retry)
            .onErrorMap(e -> !(e instanceof SourceFetchException),
                e -> new SourceUnavailableException(source, operation + " failed: " + e.getMessage(), e));
    }
}
