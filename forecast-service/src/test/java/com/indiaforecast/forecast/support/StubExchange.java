package com.indiaforecast.forecast.support;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** {@link ExchangeFunction} that answers from a function and records every request URI. */
public class StubExchange implements ExchangeFunction {

    private final Function<ClientRequest, Mono<ClientResponse>> responder;
    private final List<URI> requests = new CopyOnWriteArrayList<>();

    private StubExchange(Function<ClientRequest, Mono<ClientResponse>> responder) {
        this.responder = responder;
    }

    public static StubExchange body(String body, MediaType type) {
        return new StubExchange(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, type.toString())
            .body(body)
            .build()));
    }

    public static StubExchange status(HttpStatus status) {
        return new StubExchange(request -> Mono.just(ClientResponse.create(status).build()));
    }

    /** Never answers; every attempt ends in the caller's timeout. */
    public static StubExchange hang() {
        return new StubExchange(request -> Mono.never());
    }

    public WebClient client(String baseUrl) {
        return WebClient.builder().baseUrl(baseUrl).exchangeFunction(this).build();
    }

    public List<URI> requests() {
        return requests;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        return Mono.defer(() -> {
            requests.add(request.url());
            return responder.apply(request);
        });
    }
}
