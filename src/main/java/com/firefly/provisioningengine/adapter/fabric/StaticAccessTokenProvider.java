package com.firefly.provisioningengine.adapter.fabric;

import com.firefly.provisioningengine.exceptions.PermanentAdapterException;
import reactor.core.publisher.Mono;

/** Returns one configured token for every scope. */
public class StaticAccessTokenProvider implements AccessTokenProvider {
    private final String token;

    public StaticAccessTokenProvider(String token) {
        this.token = token;
    }

    @Override
    public Mono<String> token(String scope) {
        if (token == null || token.isBlank()) {
            return Mono.error(new PermanentAdapterException(
                    "No access token configured (firefly.provisioning.fabric.access-token)"));
        }
        return Mono.just(token);
    }
}
