package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import com.firefly.provisioningengine.exceptions.TransientAdapterException;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Thin reactive client for the Fabric REST API.
 * <p>
 * Long-running operations answer {@code 202} with an operation id in {@code x-ms-operation-id} (or at the end of
 * the {@code Location} header); {@link #postAndWait} polls {@code /operations/{id}} until the operation settles.
 */
public class FabricRestClient {
    private static final Logger log = LoggerFactory.getLogger(FabricRestClient.class);

    public static final String SCOPE = "https://api.fabric.microsoft.com/.default";
    public static final String OPERATION_HEADER = "x-ms-operation-id";

    private final WebClient webClient;
    private final AccessTokenProvider tokens;
    private final ObjectMapper mapper;
    private final Duration pollInterval;
    private final Duration operationTimeout;

    public FabricRestClient(WebClient webClient, AccessTokenProvider tokens, ObjectMapper mapper,
                            Duration pollInterval, Duration operationTimeout) {
        this.webClient = webClient;
        this.tokens = tokens;
        this.mapper = mapper;
        this.pollInterval = pollInterval;
        this.operationTimeout = operationTimeout;
    }

    public Mono<JsonNode> get(String path) {
        return exchange(HttpMethod.GET, path, null).map(FabricResponse::body);
    }

    public Mono<FabricResponse> post(String path, Object body) {
        return exchange(HttpMethod.POST, path, body == null ? Map.of() : body);
    }

    /** Items of a list endpoint ({@code {"value":[...]}}). */
    public Flux<JsonNode> list(String path) {
        return get(path).flatMapIterable(node -> node.path("value"));
    }

    /** First item of a list endpoint whose display name (and type, when given) matches. */
    public Mono<JsonNode> findByDisplayName(String path, String displayName, String type) {
        return list(path)
                .filter(item -> displayName.equals(item.path("displayName").asText()))
                .filter(item -> type == null || type.equals(item.path("type").asText(type)))
                .next();
    }

    /** POSTs and, when the call is accepted as a long-running operation, waits for its result. */
    public Mono<JsonNode> postAndWait(String path, Object body, String label) {
        return post(path, body).flatMap(response -> response.isAccepted()
                ? waitForOperation(response.headers(), label)
                : Mono.just(response.body()));
    }

    public Mono<JsonNode> waitForOperation(HttpHeaders headers, String label) {
        Optional<String> operationId = operationId(headers);
        if (operationId.isEmpty()) {
            log.warn(JsonUtils.json("fabric_lro", "no_operation_id", "label", label));
            return Mono.just(MissingNode.getInstance());
        }
        String opId = operationId.get();
        log.info(JsonUtils.json("fabric_lro", "polling", "label", label, "operationId", opId));
        return Mono.defer(() -> get("/operations/" + opId))
                .delaySubscription(pollInterval)
                .flatMap(op -> {
                    String status = op.path("status").asText("").toLowerCase();
                    if ("succeeded".equals(status)) {
                        log.info(JsonUtils.json("fabric_lro", "succeeded", "label", label, "operationId", opId));
                        return get("/operations/" + opId + "/result")
                                .onErrorResume(FabricApiException.class, e -> Mono.just(op));
                    }
                    // the platform rejected the request; repeating it yields the same verdict
                    if ("failed".equals(status) || "cancelled".equals(status)) {
                        return Mono.error(new PermanentAdapterException(
                                "Operation " + label + " " + status + ": " + op.path("error")));
                    }
                    return Mono.error(new OperationPending(status));
                })
                .retryWhen(Retry.indefinitely().filter(OperationPending.class::isInstance))
                .timeout(operationTimeout, Mono.error(() -> new TransientAdapterException(
                        "Operation " + label + " timed out after " + operationTimeout.toSeconds() + "s")));
    }

    static Optional<String> operationId(HttpHeaders headers) {
        String id = headers.getFirst(OPERATION_HEADER);
        if (id != null && !id.isBlank()) {
            return Optional.of(id);
        }
        String location = headers.getFirst(HttpHeaders.LOCATION);
        if (location != null && location.contains("/operations/")) {
            String tail = location.substring(location.lastIndexOf("/operations/") + "/operations/".length());
            int q = tail.indexOf('?');
            return Optional.of(q >= 0 ? tail.substring(0, q) : tail).filter(s -> !s.isBlank());
        }
        return Optional.empty();
    }

    private Mono<FabricResponse> exchange(HttpMethod method, String path, Object body) {
        return tokens.token(SCOPE).flatMap(token -> {
            WebClient.RequestBodySpec spec = webClient.method(method)
                    .uri(path)
                    .headers(h -> h.setBearerAuth(token))
                    .accept(MediaType.APPLICATION_JSON);
            WebClient.RequestHeadersSpec<?> request = body == null
                    ? spec
                    : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
            return request.exchangeToMono(response -> toResponse(method, path, response));
        });
    }

    private Mono<FabricResponse> toResponse(HttpMethod method, String path, ClientResponse response) {
        int status = response.statusCode().value();
        HttpHeaders headers = response.headers().asHttpHeaders();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> {
                    if (status < 200 || status >= 300) {
                        return Mono.error(new FabricApiException(status, "Fabric API " + method + " " + path
                                + " failed (" + status + "): " + JsonUtils.safeString(text, 500)));
                    }
                    return Mono.just(new FabricResponse(status, headers, parse(text)));
                });
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            ObjectNode raw = mapper.createObjectNode();
            raw.put("raw", JsonUtils.safeString(text, 500));
            return raw;
        }
    }

    private static final class OperationPending extends RuntimeException {
        OperationPending(String status) {
            super("Operation still " + (status.isBlank() ? "pending" : status), null, false, false);
        }
    }
}
