package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fabric workspace. A workspace id from configuration or the request ({@code workspace_id}) is used as-is when it
 * resolves; otherwise the workspace is found or created by display name on the configured capacity.
 */
public class FabricWorkspaceAdapter implements ResourceAdapter {
    private final FabricRestClient client;

    public FabricWorkspaceAdapter(FabricRestClient client) {
        this.client = client;
    }

    @Override
    public String key() {
        return AdapterKeys.WORKSPACE;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        Mono<JsonNode> byName = Mono.defer(() -> client.findByDisplayName("/workspaces", target.name(), null));
        Mono<JsonNode> found = target.value(ConfigKeys.WORKSPACE_ID)
                .map(id -> client.get("/workspaces/" + id)
                        .onErrorResume(FabricApiException.class,
                                e -> e.getStatus() == 404 ? Mono.empty() : Mono.error(e))
                        .switchIfEmpty(byName))
                .orElse(byName);
        return found.map(FabricWorkspaceAdapter::toDiscovered);
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("displayName", target.name());
        target.value(ConfigKeys.CAPACITY_ID).ifPresent(c -> body.put("capacityId", c));
        return client.postAndWait("/workspaces", body, "create workspace")
                .map(node -> {
                    if (node.path("id").asText("").isBlank()) {
                        throw new PermanentAdapterException("Workspace '" + target.name() + "' was not returned by create");
                    }
                    return toDiscovered(node);
                });
    }

    private static DiscoveredResource toDiscovered(JsonNode node) {
        return DiscoveredResource.of(ConfigKeys.WORKSPACE_ID, node.path("id").asText())
                .with(ConfigKeys.WORKSPACE_NAME, node.path("displayName").asText(null));
    }
}
