package com.firefly.provisioningengine.health;

import com.firefly.provisioningengine.adapter.fabric.FabricApiException;
import com.firefly.provisioningengine.adapter.fabric.FabricRestClient;
import reactor.core.publisher.Mono;

public class FabricWorkspaceProbe implements WorkspaceProbe {
    private final FabricRestClient client;

    public FabricWorkspaceProbe(FabricRestClient client) {
        this.client = client;
    }

    @Override
    public Mono<Boolean> reachable(String workspaceId) {
        return client.get("/workspaces/" + workspaceId)
                .map(body -> true)
                .onErrorResume(e -> e instanceof FabricApiException fe
                        && (fe.getStatus() == 404 || fe.getStatus() == 403), e -> Mono.just(false));
    }
}
