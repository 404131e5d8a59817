package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.TransientAdapterException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Waits for Fabric to finish indexing the ontology, i.e. for its graph model to appear. Polls every
 * {@code pollInterval} up to {@code timeout}; running out of time is a transient failure so the run can be
 * retried from this step.
 */
public class GraphIndexAdapter implements ResourceAdapter {
    private final GraphModelLocator locator;
    private final Duration pollInterval;
    private final Duration timeout;

    public GraphIndexAdapter(GraphModelLocator locator, Duration pollInterval, Duration timeout) {
        this.locator = locator;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    @Override
    public String key() {
        return AdapterKeys.GRAPH_INDEX;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        return locate(target).map(model -> DiscoveredResource.none());
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        return Mono.defer(() -> locate(target))
                .switchIfEmpty(Mono.error(() -> new StillIndexing(target.name())))
                .map(model -> DiscoveredResource.none())
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, pollInterval).filter(StillIndexing.class::isInstance))
                .timeout(timeout, Mono.error(() -> new TransientAdapterException(
                        "Ontology '" + target.name() + "' is still indexing after " + timeout.toSeconds() + "s")));
    }

    private Mono<JsonNode> locate(ResourceTarget target) {
        String ontologyName = target.value(ConfigKeys.ONTOLOGY_NAME).orElse(target.name());
        return locator.find(target.require(ConfigKeys.WORKSPACE_ID), ontologyName, false);
    }

    private static final class StillIndexing extends RuntimeException {
        StillIndexing(String ontology) {
            super("Ontology " + ontology + " still indexing", null, false, false);
        }
    }
}
