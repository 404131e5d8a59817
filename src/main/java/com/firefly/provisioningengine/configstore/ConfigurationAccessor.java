package com.firefly.provisioningengine.configstore;

import com.firefly.provisioningengine.util.JsonUtils;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single entry point to the shared configuration: a short-TTL cache in front of a {@link ConfigurationStore}.
 * <p>
 * Static defaults sit beneath the store's values. {@link #write(Map)} writes through and invalidates the cache
 * before completing, so a reader that starts after the write completes always sees the new values. Readers that
 * do not go through a write observe changes within the TTL.
 */
public class ConfigurationAccessor {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationAccessor.class);
    private static final String SNAPSHOT = "snapshot";

    private final ConfigurationStore store;
    private final Map<String, String> defaults;
    private final Cache<String, ConfigurationSnapshot> cache;
    private final AtomicLong generation = new AtomicLong();
    private final List<Runnable> invalidationListeners = new CopyOnWriteArrayList<>();

    public ConfigurationAccessor(ConfigurationStore store, Map<String, String> defaults, Duration ttl) {
        this(store, defaults, ttl, Ticker.systemTicker());
    }

    public ConfigurationAccessor(ConfigurationStore store, Map<String, String> defaults, Duration ttl, Ticker ticker) {
        this.store = store;
        this.defaults = defaults == null ? Map.of() : Map.copyOf(defaults);
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /** Current configuration, served from cache when fresh. */
    public Mono<ConfigurationSnapshot> current() {
        ConfigurationSnapshot cached = cache.getIfPresent(SNAPSHOT);
        if (cached != null) {
            return Mono.just(cached);
        }
        long gen = generation.get();
        return store.load().map(values -> {
            Map<String, String> merged = new LinkedHashMap<>(defaults);
            values.forEach((k, v) -> { if (v != null && !v.isBlank()) merged.put(k, v); });
            ConfigurationSnapshot snapshot = ConfigurationSnapshot.of(merged);
            // a write that raced with this load must not be shadowed by a stale snapshot
            if (generation.get() == gen) {
                cache.put(SNAPSHOT, snapshot);
            }
            return snapshot;
        });
    }

    /** Writes through to the store and invalidates the cache before the returned Mono completes. */
    public Mono<Void> write(Map<String, String> updates) {
        if (updates == null || updates.isEmpty()) {
            return Mono.empty();
        }
        return store.write(updates)
                .then(Mono.fromRunnable(() -> {
                    invalidate();
                    log.info(JsonUtils.json(
                            "config_event", "write",
                            "keys", String.join(",", updates.keySet())
                    ));
                }));
    }

    public void invalidate() {
        generation.incrementAndGet();
        cache.invalidateAll();
        for (Runnable listener : invalidationListeners) {
            listener.run();
        }
    }

    /** Registers a callback run synchronously on every invalidation (e.g. to drop dependent caches). */
    public void addInvalidationListener(Runnable listener) {
        invalidationListeners.add(listener);
    }
}
