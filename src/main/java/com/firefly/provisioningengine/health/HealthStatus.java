package com.firefly.provisioningengine.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Readiness of the provisioned workspace for queries. */
public record HealthStatus(
        @JsonProperty("configured") boolean configured,
        @JsonProperty("workspace_connected") boolean workspaceConnected,
        @JsonProperty("query_ready") boolean queryReady,
        @JsonProperty("workspace_id") String workspaceId,
        @JsonProperty("graph_model_id") String graphModelId) {

    public static HealthStatus unconfigured() {
        return new HealthStatus(false, false, false, null, null);
    }
}
