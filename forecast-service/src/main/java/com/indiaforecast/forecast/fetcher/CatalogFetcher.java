package com.indiaforecast.forecast.fetcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.ForecastRecord;
import com.indiaforecast.common.model.Measurement;
import com.indiaforecast.common.model.Prediction;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Serves a curated JSON extract bundled with the service, for sources whose documents
 * (plan PDFs, strategy papers) cannot be fetched and parsed live.
 *
 * <p>The document is read and validated on first use and then kept; a malformed document
 * fails every call with {@link SourceParseException}.
 */
public class CatalogFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(CatalogFetcher.class);

    private final SourceId source;
    private final Resource resource;
    private final ObjectMapper objectMapper;

    private volatile CatalogDocument document;

    public CatalogFetcher(SourceId source, Resource resource, ObjectMapper objectMapper) {
        this.source       = source;
        this.resource     = resource;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceId source() {
        return source;
    }

    @Override
    public Mono<List<ForecastRecord>> fetchHistorical(int forecastYear, int targetYear, Sector sector) {
        return load().map(doc -> doc.forecasts().stream()
            .filter(f -> f.in(sector) && f.forecastYear() == forecastYear && f.targetYear() == targetYear)
            .map(f -> new ForecastRecord(f.metric(), Measurement.of(f.value(), f.unit()), source, sector,
                f.forecastYear(), f.targetYear(), f.url(), f.confidence()))
            .toList());
    }

    @Override
    public Mono<ActualRecord> fetchActual(int year, Sector sector) {
        return load().flatMap(doc -> Mono.justOrEmpty(doc.actuals().stream()
            .filter(a -> a.in(sector) && a.year() == year)
            .findFirst()
            .map(a -> new ActualRecord(a.metric(), Measurement.of(a.value(), a.unit()), sector, year, source, a.url()))));
    }

    @Override
    public Mono<Prediction> fetchCurrent(int targetYear, Sector sector) {
        return load().flatMap(doc -> Mono.justOrEmpty(doc.targets().stream()
            .filter(t -> t.in(sector) && t.targetYear() == targetYear)
            .findFirst()
            .map(t -> new Prediction(t.metric(), Measurement.of(t.targetValue(), t.unit()),
                Measurement.of(t.progressValue(), t.unit()), source, sector,
                t.announcementYear(), t.targetYear(), t.url(), t.confidence()))));
    }

    private Mono<CatalogDocument> load() {
        CatalogDocument loaded = document;
        if (loaded != null) {
            return Mono.just(loaded);
        }
        return Mono.fromCallable(this::read).subscribeOn(Schedulers.boundedElastic());
    }

    private CatalogDocument read() {
        CatalogDocument doc;
        try (InputStream in = resource.getInputStream()) {
            doc = objectMapper.readValue(in, CatalogDocument.class);
        } catch (IOException e) {
            throw new SourceParseException(source, "cannot read catalog " + resource.getDescription(), e);
        }
        validate(doc);
        document = doc;
        log.info("Catalog loaded. source={} version={} forecasts={} actuals={} targets={}",
            source, doc.version(), doc.forecasts().size(), doc.actuals().size(), doc.targets().size());
        return doc;
    }

    private void validate(CatalogDocument doc) {
        try {
            doc.forecasts().forEach(f -> Sector.fromLabel(f.sector()));
            doc.actuals().forEach(a -> Sector.fromLabel(a.sector()));
            for (CatalogDocument.Target t : doc.targets()) {
                Sector sector = Sector.fromLabel(t.sector());
                new Prediction(t.metric(), Measurement.of(t.targetValue(), t.unit()),
                    Measurement.of(t.progressValue(), t.unit()), source, sector,
                    t.announcementYear(), t.targetYear(), t.url(), t.confidence());
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new SourceParseException(source, "invalid catalog entry: " + e.getMessage(), e);
        }
    }
}
