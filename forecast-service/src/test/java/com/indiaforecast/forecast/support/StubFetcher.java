package com.indiaforecast.forecast.support;

import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.fetcher.SourceFetcher;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory fetcher with canned data and call counting. {@link #failWith} makes every
 * call fail with the given error instead.
 */
public class StubFetcher implements SourceFetcher {

    private final SourceId source;
    private final List<ForecastRecord> forecasts = new ArrayList<>();
    private final List<ActualRecord> actuals = new ArrayList<>();
    private final List<Prediction> predictions = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile RuntimeException failure;

    public StubFetcher(SourceId source) {
        this.source = source;
    }

    public StubFetcher withForecast(ForecastRecord forecast) {
        forecasts.add(forecast);
        return this;
    }

    public StubFetcher withActual(ActualRecord actual) {
        actuals.add(actual);
        return this;
    }

    public StubFetcher withPrediction(Prediction prediction) {
        predictions.add(prediction);
        return this;
    }

    public StubFetcher failWith(RuntimeException error) {
        this.failure = error;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public SourceId source() {
        return source;
    }

    @Override
    public Mono<List<ForecastRecord>> fetchHistorical(int forecastYear, int targetYear, Sector sector) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (failure != null) {
                return Mono.error(failure);
            }
            return Mono.just(forecasts.stream()
                .filter(f -> f.sector() == sector && f.forecastYear() == forecastYear && f.targetYear() == targetYear)
                .toList());
        });
    }

    @Override
    public Mono<ActualRecord> fetchActual(int year, Sector sector) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (failure != null) {
                return Mono.error(failure);
            }
            return Mono.justOrEmpty(actuals.stream()
                .filter(a -> a.sector() == sector && a.year() == year)
                .findFirst());
        });
    }

    @Override
    public Mono<Prediction> fetchCurrent(int targetYear, Sector sector) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (failure != null) {
                return Mono.error(failure);
            }
            return Mono.justOrEmpty(predictions.stream()
                .filter(p -> p.sector() == sector && p.targetYear() == targetYear)
                .findFirst());
        });
    }
}
