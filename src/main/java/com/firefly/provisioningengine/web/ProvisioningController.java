package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.core.RunSnapshot;
import com.firefly.provisioningengine.engine.ProvisioningEngine;
import com.firefly.provisioningengine.engine.ProvisioningRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/provisioning")
public class ProvisioningController {
    private final ProvisioningEngine engine;

    public ProvisioningController(ProvisioningEngine engine) {
        this.engine = engine;
    }

    /**
     * Starts provisioning and streams progress as server-sent events. The run keeps going if the client
     * disconnects; reattach with {@code GET .../events}.
     */
    @PostMapping(value = "/{scenarioId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ProgressEvent>>> provision(@PathVariable String scenarioId,
                                                               @RequestBody(required = false) ProvisioningRequestBody body) {
        ProvisioningRequest request = body == null ? ProvisioningRequest.of(scenarioId) : body.toRequest(scenarioId);
        return engine.start(request)
                .map(events -> ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(events));
    }

    @GetMapping("/{scenarioId}/status")
    public Mono<RunSnapshot> status(@PathVariable String scenarioId) {
        return Mono.fromCallable(() -> engine.status(scenarioId)
                .orElseThrow(() -> new NoSuchElementException("No provisioning run for scenario '" + scenarioId + "'")));
    }

    @GetMapping(value = "/{scenarioId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ProgressEvent>>> events(@PathVariable String scenarioId) {
        return status(scenarioId)
                .map(snapshot -> ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM)
                        .body(engine.reconnect(scenarioId)));
    }

    @PostMapping("/{scenarioId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String scenarioId) {
        return engine.cancel(scenarioId)
                ? ResponseEntity.status(HttpStatus.ACCEPTED).build()
                : ResponseEntity.notFound().build();
    }
}
