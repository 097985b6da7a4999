package com.indiaforecast.forecast.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indiaforecast.common.exception.SourceParseException;
import com.indiaforecast.common.model.ActualRecord;
import com.indiaforecast.common.model.Measurement;
import com.indiaforecast.common.model.Sector;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.config.FetchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Actual outcomes from the World Bank v2 indicator API, one request per (indicator, year):
 * {@code GET {base}/{code}?format=json&date={year}&per_page=1}.
 *
 * <p>The API answers {@code [meta, [row...]]}; a row with a {@code null} value or an empty
 * page means no figure for that year. Errors come back as {@code [{"message": [...]}]} with
 * status 200 and are treated as parse errors.
 */
public class WorldBankFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(WorldBankFetcher.class);

    /** World Development Indicators start here. */
    static final int FIRST_YEAR = 1960;

    private static final String INDICATOR_PAGE = "https://data.worldbank.org/indicator/%s?locations=IN";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final FetchSettings settings;

    public WorldBankFetcher(WebClient worldBankWebClient, ObjectMapper objectMapper, FetchSettings settings) {
        this.webClient    = worldBankWebClient;
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    @Override
    public SourceId source() {
        return SourceId.WORLD_BANK;
    }

    @Override
    public boolean covers(int year) {
        return year >= FIRST_YEAR;
    }

    @Override
    public Mono<ActualRecord> fetchActual(int year, Sector sector) {
        WorldBankIndicator indicator = WorldBankIndicator.forSector(sector).orElse(null);
        if (indicator == null) {
            log.debug("No World Bank indicator for sector={}", sector);
            return Mono.empty();
        }
        log.info("Fetching actual. source=WORLD_BANK indicator={} year={}", indicator.code(), year);

        Mono<String> call = webClient.get()
            .uri(uri -> uri.path("/{code}")
                .queryParam("format", "json")
                .queryParam("date", year)
                .queryParam("per_page", 1)
                .build(indicator.code()))
            .retrieve()
            .bodyToMono(String.class);

        return FetchRetrySupport.withRetry(call, source(), "actual " + indicator.code() + " " + year, settings)
            .flatMap(json -> Mono.justOrEmpty(parse(json, indicator, sector, year)));
    }

    ActualRecord parse(String json, WorldBankIndicator indicator, Sector sector, int year) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceParseException(source(), "invalid JSON for " + indicator.code(), e);
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new SourceParseException(source(), "expected a JSON array for " + indicator.code());
        }
        JsonNode meta = root.get(0);
        if (meta.has("message")) {
            throw new SourceParseException(source(), "API error for " + indicator.code() + ": "
                + meta.path("message").path(0).path("value").asText("unknown"));
        }
        JsonNode rows = root.path(1);
        if (!rows.isArray() || rows.isEmpty()) {
            return null;
        }
        JsonNode value = rows.get(0).path("value");
        if (value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new SourceParseException(source(), "non-numeric value for " + indicator.code() + ": " + value);
        }
        return new ActualRecord(
            indicator.metric(),
            Measurement.of(value.asDouble(), indicator.unit()),
            sector,
            year,
            source(),
            String.format(INDICATOR_PAGE, indicator.code()));
    }
}
