package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.TransientAdapterException;
import reactor.core.publisher.Mono;

/**
 * Records the graph model id the query path needs. Nothing is created: the model is derived by Fabric, so a missing
 * model is a transient failure.
 */
public class GraphModelDiscoveryAdapter implements ResourceAdapter {
    private final GraphModelLocator locator;

    public GraphModelDiscoveryAdapter(GraphModelLocator locator) {
        this.locator = locator;
    }

    @Override
    public String key() {
        return AdapterKeys.GRAPH_MODEL;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        String ontologyName = target.value(ConfigKeys.ONTOLOGY_NAME).orElse(target.name());
        return locator.find(target.require(ConfigKeys.WORKSPACE_ID), ontologyName, true)
                .map(model -> DiscoveredResource.of(ConfigKeys.GRAPH_MODEL_ID, model.path("id").asText()));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        return exists(target).switchIfEmpty(Mono.error(() -> new TransientAdapterException(
                "Graph model for '" + target.name() + "' is not yet visible")));
    }
}
