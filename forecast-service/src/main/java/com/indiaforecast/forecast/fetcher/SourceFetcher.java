package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface, one implementation per source. A fetcher overrides only the
 * operations its source supports; the defaults contribute nothing.
 *
 * <p>Failures are signalled only as
 * {@link com.indiaforecast.common.exception.SourceUnavailableException} or
 * {@link com.indiaforecast.common.exception.SourceParseException}.
 */
public interface SourceFetcher {

    SourceId source();

    /**
     * Whether the source can hold anything for {@code year} (the forecast year for
     * historical calls, the year itself for actuals, the target year for current calls).
     * The orchestrator skips uncovered years without a call.
     */
    default boolean covers(int year) {
        return true;
    }

    /** Forecasts published in {@code forecastYear} about {@code targetYear}. */
    default Mono<List<ForecastRecord>> fetchHistorical(int forecastYear, int targetYear, Sector sector) {
        return Mono.just(List.of());
    }

    /** Empty when the source has no figure for that year. */
    default Mono<ActualRecord> fetchActual(int year, Sector sector) {
        return Mono.empty();
    }

    /** Empty when the source tracks no open target for that year. */
    default Mono<Prediction> fetchCurrent(int targetYear, Sector sector) {
        return Mono.empty();
    }
}
