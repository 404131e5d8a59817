package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;

/** Status, headers and parsed body of a successful Fabric call. */
public record FabricResponse(int status, HttpHeaders headers, JsonNode body) {

    public boolean isAccepted() {
        return status == 202;
    }
}
