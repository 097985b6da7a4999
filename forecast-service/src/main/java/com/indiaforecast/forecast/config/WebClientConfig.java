package com.indiaforecast.forecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.indiaforecast.common.model.SourceId;
import com.indiaforecast.forecast.fetcher.CatalogFetcher;
import com.indiaforecast.forecast.fetcher.RssProjectionFetcher;
import com.indiaforecast.forecast.fetcher.SourceFetcher;
import com.indiaforecast.forecast.fetcher.SourceFetchers;
import com.indiaforecast.forecast.fetcher.WorldBankFetcher;
import com.indiaforecast.forecast.registry.SourceRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * HTTP plumbing and the fetcher beans. Every fetcher registered here ends up in
 * {@link SourceFetchers}; adding a source means adding a bean, nothing else.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_FEED_BYTES = 4 * 1024 * 1024;

    @Bean
    public ReactorClientHttpConnector sourceConnector(FetchSettings settings) {
        long timeoutMillis = settings.requestTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, 10_000))
            .responseTimeout(settings.requestTimeout())
            .followRedirect(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    // ── live sources ─────────────────────────────────────────────────────────

    @Bean
    public WorldBankFetcher worldBankFetcher(WebClient.Builder builder, ReactorClientHttpConnector sourceConnector,
                                             SourceRegistry registry, ObjectMapper objectMapper,
                                             FetchSettings settings) {
        return new WorldBankFetcher(client(builder, sourceConnector, registry, SourceId.WORLD_BANK),
            objectMapper, settings);
    }

    @Bean
    public RssProjectionFetcher rbiFetcher(WebClient.Builder builder, ReactorClientHttpConnector sourceConnector,
                                           SourceRegistry registry, FetchSettings settings, Clock clock) {
        return new RssProjectionFetcher(SourceId.RBI,
            client(builder, sourceConnector, registry, SourceId.RBI), settings, clock);
    }

    @Bean
    public RssProjectionFetcher economicTimesFetcher(WebClient.Builder builder, ReactorClientHttpConnector sourceConnector,
                                                     SourceRegistry registry, FetchSettings settings, Clock clock) {
        return new RssProjectionFetcher(SourceId.ECONOMIC_TIMES,
            client(builder, sourceConnector, registry, SourceId.ECONOMIC_TIMES), settings, clock);
    }

    @Bean
    public RssProjectionFetcher theHinduFetcher(WebClient.Builder builder, ReactorClientHttpConnector sourceConnector,
                                                SourceRegistry registry, FetchSettings settings, Clock clock) {
        return new RssProjectionFetcher(SourceId.THE_HINDU,
            client(builder, sourceConnector, registry, SourceId.THE_HINDU), settings, clock);
    }

    // ── bundled catalogs ─────────────────────────────────────────────────────

    @Bean
    public CatalogFetcher planningCommissionFetcher(ObjectMapper objectMapper) {
        return new CatalogFetcher(SourceId.PLANNING_COMMISSION,
            new ClassPathResource("catalog/planning-commission.json"), objectMapper);
    }

    @Bean
    public CatalogFetcher nitiAayogFetcher(ObjectMapper objectMapper) {
        return new CatalogFetcher(SourceId.NITI_AAYOG, new ClassPathResource("catalog/niti-aayog.json"), objectMapper);
    }

    @Bean
    public CatalogFetcher pibFetcher(ObjectMapper objectMapper) {
        return new CatalogFetcher(SourceId.PIB, new ClassPathResource("catalog/pib.json"), objectMapper);
    }

    @Bean
    public CatalogFetcher mospiFetcher(ObjectMapper objectMapper) {
        return new CatalogFetcher(SourceId.MOSPI, new ClassPathResource("catalog/mospi.json"), objectMapper);
    }

    @Bean
    public SourceFetchers sourceFetchers(List<SourceFetcher> fetchers) {
        return new SourceFetchers(fetchers);
    }

    private WebClient client(WebClient.Builder builder, ReactorClientHttpConnector connector,
                             SourceRegistry registry, SourceId source) {
        String endpoint = registry.endpoint(source)
            .orElseThrow(() -> new IllegalStateException("No endpoint registered for " + source));
        return builder.clone()
            .baseUrl(endpoint)
            .clientConnector(connector)
            .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_FEED_BYTES))
            .filter(serverErrorFilter(source))
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter(SourceId source) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.error(new IllegalStateException(source + " server error: " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
