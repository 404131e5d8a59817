package com.firefly.provisioningengine.web;

import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.InMemoryConfigurationStore;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationControllerTest {

    private final ConfigurationAccessor accessor = new ConfigurationAccessor(
            new InMemoryConfigurationStore(Map.of(ConfigKeys.WORKSPACE_ID, "ws-1")),
            Map.of(ConfigKeys.WORKSPACE_NAME, "fabric-demo"), Duration.ofMinutes(5));
    private final WebTestClient client = WebTestClient.bindToController(new ConfigurationController(accessor))
            .controllerAdvice(new ProvisioningExceptionHandler())
            .build();

    @Test
    void readReturnsStoreValuesOverDefaults() {
        client.get().uri("/api/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.FABRIC_WORKSPACE_ID").isEqualTo("ws-1")
                .jsonPath("$.FABRIC_WORKSPACE_NAME").isEqualTo("fabric-demo");
    }

    @Test
    void writeIsImmediatelyVisible() {
        client.post().uri("/api/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(ConfigKeys.GRAPH_MODEL_ID, "gm-9"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.FABRIC_GRAPH_MODEL_ID").isEqualTo("gm-9")
                .jsonPath("$.FABRIC_WORKSPACE_ID").isEqualTo("ws-1");

        assertEquals("gm-9", accessor.current().block().graphModelId().orElseThrow());
    }

    @Test
    void invalidKeysAreRejected() {
        client.post().uri("/api/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("lower-case", "x"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("Invalid configuration key 'lower-case'");

        client.post().uri("/api/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest();
    }
}
