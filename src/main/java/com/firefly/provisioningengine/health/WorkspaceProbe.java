package com.firefly.provisioningengine.health;

import reactor.core.publisher.Mono;

/**
 * Checks that a workspace id resolves on the platform. Emits {@code false} when the workspace is gone;
 * errors mean the platform could not be asked.
 */
public interface WorkspaceProbe {

    Mono<Boolean> reachable(String workspaceId);
}
