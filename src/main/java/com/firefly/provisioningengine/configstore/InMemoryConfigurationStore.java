package com.firefly.provisioningengine.configstore;

import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local store. Used by default and in tests; values do not survive a restart.
 */
public class InMemoryConfigurationStore implements ConfigurationStore {
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final AtomicInteger loads = new AtomicInteger();

    public InMemoryConfigurationStore() {
    }

    public InMemoryConfigurationStore(Map<String, String> initial) {
        if (initial != null) values.putAll(initial);
    }

    @Override
    public Mono<Map<String, String>> load() {
        return Mono.fromCallable(() -> {
            loads.incrementAndGet();
            return (Map<String, String>) new LinkedHashMap<>(values);
        });
    }

    @Override
    public Mono<Void> write(Map<String, String> updates) {
        return Mono.fromRunnable(() -> updates.forEach((k, v) -> {
            if (v == null) values.remove(k); else values.put(k, v);
        }));
    }

    /** Number of times {@link #load()} hit the store; lets callers observe caching. */
    public int loadCount() {
        return loads.get();
    }
}
