package com.firefly.provisioningengine.configstore;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Shared key/value configuration written by provisioning runs and connect-workspace flows,
 * read by query backends and health checks. Callers normally go through {@link ConfigurationAccessor}.
 */
public interface ConfigurationStore {

    Mono<Map<String, String>> load();

    /** Upserts the given keys; keys not mentioned are left untouched. */
    Mono<Void> write(Map<String, String> updates);
}
