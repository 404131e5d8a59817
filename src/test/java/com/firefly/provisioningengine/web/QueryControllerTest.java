package com.firefly.provisioningengine.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.dispatch.ConnectorRegistry;
import com.firefly.provisioningengine.dispatch.QueryDispatcher;
import com.firefly.provisioningengine.dispatch.TelemetryBackend;
import com.firefly.provisioningengine.dispatch.ValueNormalizer;
import com.firefly.provisioningengine.dispatch.mock.MockQueryBackend;
import com.firefly.provisioningengine.scenario.MapScenarioCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryControllerTest {

    private WebTestClient client() {
        TelemetryBackend kql = mock(TelemetryBackend.class);
        when(kql.connector()).thenReturn(Connectors.FABRIC_KQL);
        when(kql.query(any(), any())).thenReturn(Mono.error(new IllegalStateException("Syntax error")));
        MockQueryBackend mock = new MockQueryBackend();
        QueryDispatcher dispatcher = new QueryDispatcher(
                new MapScenarioCatalog(Map.of("telco-noc", ScenarioConfig.builder("telco-noc")
                        .dataSource(ScenarioConfig.GRAPH, Connectors.MOCK)
                        .dataSource(ScenarioConfig.TELEMETRY, Connectors.FABRIC_KQL)
                        .build())),
                new ConnectorRegistry<>(ScenarioConfig.GRAPH, List.of(mock)),
                new ConnectorRegistry<>(ScenarioConfig.TELEMETRY, List.of(kql)),
                new ValueNormalizer(new ObjectMapper()));
        return WebTestClient.bindToController(new QueryController(dispatcher))
                .controllerAdvice(new ProvisioningExceptionHandler())
                .build();
    }

    @Test
    void graphQueryReturnsRows() {
        client().post().uri("/api/query/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scenario_id\":\"telco-noc\",\"query\":\"MATCH (n) RETURN n\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.columns[0].name").isEqualTo("id")
                .jsonPath("$.rows[0].id").isEqualTo("CORE-SYD-01")
                .jsonPath("$.rows[0].observed_at").isEqualTo("2024-01-01T00:00:00Z")
                .jsonPath("$.error").doesNotExist();
    }

    @Test
    void backendErrorsAreReturnedInTheBody() {
        client().post().uri("/api/query/telemetry")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scenario_id\":\"telco-noc\",\"query\":\"Foo |\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.error").value(msg -> assertTrue(
                        ((String) msg).contains("Syntax error")))
                .jsonPath("$.rows").isEmpty();
    }

    @Test
    void unknownScenarioIsABadRequest() {
        client().post().uri("/api/query/graph")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"scenario_id\":\"nope\",\"query\":\"MATCH (n) RETURN n\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
