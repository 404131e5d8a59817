package com.firefly.provisioningengine.adapter.fabric;

import reactor.core.publisher.Mono;

/**
 * Supplies bearer tokens for the target platform. Credential acquisition happens outside this library; hosts
 * plug in their own provider (managed identity, workload identity, ...).
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /** @param scope resource scope, e.g. {@code https://api.fabric.microsoft.com/.default} */
    Mono<String> token(String scope);
}
