package com.firefly.provisioningengine.health;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.inmemory.InMemoryResourcePlatform;
import reactor.core.publisher.Mono;

public class InMemoryWorkspaceProbe implements WorkspaceProbe {
    private final InMemoryResourcePlatform platform;

    public InMemoryWorkspaceProbe(InMemoryResourcePlatform platform) {
        this.platform = platform;
    }

    @Override
    public Mono<Boolean> reachable(String workspaceId) {
        return Mono.fromSupplier(() -> platform.findById(AdapterKeys.WORKSPACE, workspaceId).isPresent());
    }
}
