package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.exceptions.TransientAdapterException;
import reactor.core.publisher.Mono;

/**
 * Eventhouse plus the KQL database Fabric creates with it. The database is the one whose
 * {@code parentEventhouseItemId} matches, falling back to the first database in the workspace.
 */
public class FabricEventhouseAdapter extends FabricItemAdapter {

    public FabricEventhouseAdapter(FabricRestClient client) {
        super(client, AdapterKeys.EVENTHOUSE, "eventhouses", "Eventhouse",
                ConfigKeys.EVENTHOUSE_ID, ConfigKeys.EVENTHOUSE_NAME);
    }

    @Override
    protected Mono<DiscoveredResource> describe(ResourceTarget target, String workspaceId, JsonNode item) {
        String eventhouseId = item.path("id").asText();
        return super.describe(target, workspaceId, item)
                .zipWith(findDatabase(workspaceId, eventhouseId))
                .map(t -> t.getT1()
                        .with(ConfigKeys.KQL_DB_ID, t.getT2().path("id").asText(null))
                        .with(ConfigKeys.KQL_DB_NAME, t.getT2().path("displayName").asText(null))
                        .with(ConfigKeys.EVENTHOUSE_QUERY_URI,
                                t.getT2().path("properties").path("queryServiceUri").asText(null)));
    }

    private Mono<JsonNode> findDatabase(String workspaceId, String eventhouseId) {
        return client.list("/workspaces/" + workspaceId + "/kqlDatabases")
                .collectList()
                .flatMap(dbs -> {
                    for (JsonNode db : dbs) {
                        if (eventhouseId.equals(db.path("properties").path("parentEventhouseItemId").asText())) {
                            return Mono.just(db);
                        }
                    }
                    if (!dbs.isEmpty()) {
                        return Mono.just(dbs.get(0));
                    }
                    return Mono.error(new TransientAdapterException(
                            "No KQL database found yet for eventhouse " + eventhouseId));
                });
    }
}
