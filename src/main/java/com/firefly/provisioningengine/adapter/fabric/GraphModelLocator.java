package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Finds the graph model Fabric derives from an ontology. Graph models are matched by type
 * ({@code GraphModel} or {@code Graph}) and by the ontology name appearing in their display name.
 */
public class GraphModelLocator {
    private static final List<String> GRAPH_TYPES = List.of("GraphModel", "Graph");

    private final FabricRestClient client;

    public GraphModelLocator(FabricRestClient client) {
        this.client = client;
    }

    /**
     * @param fallbackToFirst when no name matches, return the first graph model in the workspace instead of nothing
     */
    public Mono<JsonNode> find(String workspaceId, String ontologyName, boolean fallbackToFirst) {
        String needle = ontologyName.toLowerCase(Locale.ROOT);
        return client.list("/workspaces/" + workspaceId + "/items")
                .filter(item -> GRAPH_TYPES.contains(item.path("type").asText()))
                .collectList()
                .flatMap(models -> {
                    for (JsonNode model : models) {
                        if (model.path("displayName").asText("").toLowerCase(Locale.ROOT).contains(needle)) {
                            return Mono.just(model);
                        }
                    }
                    return fallbackToFirst && !models.isEmpty() ? Mono.just(models.get(0)) : Mono.empty();
                });
    }
}
