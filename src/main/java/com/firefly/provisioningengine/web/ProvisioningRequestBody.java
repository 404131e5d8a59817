package com.firefly.provisioningengine.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.firefly.provisioningengine.engine.ProvisioningRequest;

import java.util.Map;

/** JSON body of {@code POST /api/provisioning/{scenarioId}}. Both fields are optional. */
public record ProvisioningRequestBody(
        @JsonProperty("overrides") Map<String, String> overrides,
        @JsonProperty("retry_from") String retryFrom) {

    public ProvisioningRequest toRequest(String scenarioId) {
        return new ProvisioningRequest(scenarioId, overrides, retryFrom);
    }
}
