package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Find-or-create for a workspace item (lakehouse, eventhouse, ontology) by display name.
 * <p>
 * Items are listed through their dedicated endpoint ({@code /workspaces/{id}/lakehouses}); if that endpoint fails
 * the generic {@code /items} listing filtered by type is used instead.
 */
public class FabricItemAdapter implements ResourceAdapter {
    protected final FabricRestClient client;
    private final String key;
    private final String collection;
    private final String itemType;
    private final String idKey;
    private final String nameKey;

    public FabricItemAdapter(FabricRestClient client, String key, String collection, String itemType,
                             String idKey, String nameKey) {
        this.client = client;
        this.key = key;
        this.collection = collection;
        this.itemType = itemType;
        this.idKey = idKey;
        this.nameKey = nameKey;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        String workspaceId = target.require(ConfigKeys.WORKSPACE_ID);
        return findItem(workspaceId, target.name())
                .flatMap(item -> describe(target, workspaceId, item));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        String workspaceId = target.require(ConfigKeys.WORKSPACE_ID);
        return findItem(workspaceId, target.name())
                .switchIfEmpty(Mono.defer(() -> client.postAndWait(
                        "/workspaces/" + workspaceId + "/" + collection,
                        createBody(target),
                        "create " + itemType)))
                .flatMap(item -> {
                    if (item.path("id").asText("").isBlank()) {
                        return Mono.error(new PermanentAdapterException(
                                itemType + " '" + target.name() + "' was not returned by create"));
                    }
                    return describe(target, workspaceId, item);
                });
    }

    protected Map<String, Object> createBody(ResourceTarget target) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("displayName", target.name());
        return body;
    }

    /** Identifiers recorded for the item. Subclasses add derived values (e.g. the KQL database). */
    protected Mono<DiscoveredResource> describe(ResourceTarget target, String workspaceId, JsonNode item) {
        return Mono.just(DiscoveredResource.of(idKey, item.path("id").asText())
                .with(nameKey, item.path("displayName").asText(target.name())));
    }

    protected Mono<JsonNode> findItem(String workspaceId, String name) {
        String base = "/workspaces/" + workspaceId;
        return client.findByDisplayName(base + "/" + collection, name, null)
                .onErrorResume(FabricApiException.class,
                        e -> client.findByDisplayName(base + "/items", name, itemType));
    }
}
