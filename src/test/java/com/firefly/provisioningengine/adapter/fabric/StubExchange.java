package com.firefly.provisioningengine.adapter.fabric;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Answers WebClient calls from a queue of canned responses and records every request. */
public class StubExchange implements ExchangeFunction {
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private volatile String fallbackJson;

    public StubExchange respond(HttpStatus status, String json) {
        return respond(status, json, new HttpHeaders());
    }

    public StubExchange respond(HttpStatus status, String json, HttpHeaders headers) {
        synchronized (responses) {
            responses.add(ClientResponse.create(status)
                    .headers(h -> {
                        h.addAll(headers);
                        h.setContentType(MediaType.APPLICATION_JSON);
                    })
                    .body(json == null ? "" : json)
                    .build());
        }
        return this;
    }

    /** Answers 200 with {@code json} once the queue is drained. */
    public StubExchange otherwise(String json) {
        this.fallbackJson = json;
        return this;
    }

    public List<ClientRequest> requests() {
        return requests;
    }

    public WebClient webClient(String baseUrl) {
        return WebClient.builder().baseUrl(baseUrl).exchangeFunction(this).build();
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        ClientResponse next;
        synchronized (responses) {
            next = responses.poll();
        }
        if (next == null && fallbackJson != null) {
            next = ClientResponse.create(HttpStatus.OK)
                    .headers(h -> h.setContentType(MediaType.APPLICATION_JSON))
                    .body(fallbackJson)
                    .build();
        }
        return next != null
                ? Mono.just(next)
                : Mono.error(new IllegalStateException("No stubbed response for " + request.method() + " " + request.url()));
    }
}
