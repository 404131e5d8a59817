package com.firefly.provisioningengine.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.provisioningengine.adapter.fabric.FabricApiException;
import com.firefly.provisioningengine.adapter.fabric.FabricRestClient;
import com.firefly.provisioningengine.adapter.fabric.StaticAccessTokenProvider;
import com.firefly.provisioningengine.adapter.fabric.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;

class FabricWorkspaceProbeTest {

    private final StubExchange exchange = new StubExchange();
    private final FabricWorkspaceProbe probe = new FabricWorkspaceProbe(new FabricRestClient(
            exchange.webClient("https://api.fabric.test/v1"), new StaticAccessTokenProvider("tkn"),
            new ObjectMapper(), Duration.ofMillis(1), Duration.ofSeconds(1)));

    @Test
    void existingWorkspaceIsReachable() {
        exchange.respond(HttpStatus.OK, "{\"id\":\"ws-1\"}");

        StepVerifier.create(probe.reachable("ws-1")).expectNext(true).verifyComplete();
    }

    @Test
    void missingOrForbiddenWorkspaceIsUnreachable() {
        exchange.respond(HttpStatus.NOT_FOUND, "{}").respond(HttpStatus.FORBIDDEN, "{}");

        StepVerifier.create(probe.reachable("ws-1")).expectNext(false).verifyComplete();
        StepVerifier.create(probe.reachable("ws-1")).expectNext(false).verifyComplete();
    }

    @Test
    void serverErrorsPropagate() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(probe.reachable("ws-1")).expectError(FabricApiException.class).verify();
    }
}
