package com.firefly.provisioningengine.adapter.fabric;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.TransientAdapterException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphIndexAdapterTest {

    private static final String NO_MODELS = "{\"value\":[{\"id\":\"ont-1\",\"displayName\":\"telco-noc-ontology\",\"type\":\"Ontology\"}]}";
    private static final String MODEL_READY = "{\"value\":["
            + "{\"id\":\"ont-1\",\"displayName\":\"telco-noc-ontology\",\"type\":\"Ontology\"},"
            + "{\"id\":\"gm-1\",\"displayName\":\"telco-noc-ontology_graph\",\"type\":\"GraphModel\"}]}";

    private final StubExchange exchange = new StubExchange();

    private GraphIndexAdapter adapter(Duration timeout) {
        FabricRestClient client = new FabricRestClient(exchange.webClient("https://api.fabric.test/v1"),
                new StaticAccessTokenProvider("tkn"), new ObjectMapper(), Duration.ofMillis(1), Duration.ofSeconds(5));
        return new GraphIndexAdapter(new GraphModelLocator(client), Duration.ofMillis(10), timeout);
    }

    private static ResourceTarget target() {
        return new ResourceTarget(ScenarioConfig.builder("telco-noc").build(), "run-1", "indexing-wait",
                AdapterKeys.GRAPH_INDEX, "telco-noc-ontology",
                Map.of(ConfigKeys.WORKSPACE_ID, "ws-1", ConfigKeys.ONTOLOGY_NAME, "telco-noc-ontology"), null);
    }

    @Test
    void waitsUntilTheGraphModelAppears() {
        exchange.respond(HttpStatus.OK, NO_MODELS)
                .respond(HttpStatus.OK, NO_MODELS)
                .respond(HttpStatus.OK, NO_MODELS)
                .respond(HttpStatus.OK, MODEL_READY);

        StepVerifier.create(adapter(Duration.ofSeconds(5)).create(target()))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(4, exchange.requests().size());
        assertTrue(exchange.requests().get(3).url().toString().endsWith("/workspaces/ws-1/items"));
    }

    @Test
    void givesUpAsTransientWhenIndexingOutlastsTheTimeout() {
        exchange.otherwise(NO_MODELS);

        StepVerifier.create(adapter(Duration.ofMillis(150)).create(target()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(TransientAdapterException.class, e);
                    assertTrue(e.getMessage().contains("still indexing"), e.getMessage());
                })
                .verify(Duration.ofSeconds(5));

        assertTrue(exchange.requests().size() > 1, "the model should have been polled more than once");
    }

    @Test
    void existsReportsAnIndexedOntologyWithoutWaiting() {
        exchange.respond(HttpStatus.OK, NO_MODELS);

        StepVerifier.create(adapter(Duration.ofSeconds(5)).exists(target())).verifyComplete();
        assertEquals(1, exchange.requests().size());
    }
}
