package com.firefly.provisioningengine.health;

import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.configstore.ConfigurationSnapshot;
import com.firefly.provisioningengine.util.JsonUtils;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Computes and caches {@link HealthStatus}.
 * <ul>
 *   <li>{@code configured}: a workspace id is known;</li>
 *   <li>{@code workspace_connected}: the {@link WorkspaceProbe} confirms it;</li>
 *   <li>{@code query_ready}: connected and a graph model id is known.</li>
 * </ul>
 * The cached value is dropped whenever the configuration is written.
 */
public class ProvisioningHealthService {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningHealthService.class);
    private static final String KEY = "health";

    private final ConfigurationAccessor configuration;
    private final WorkspaceProbe probe;
    private final Cache<String, HealthStatus> cache;
    private final AtomicLong generation = new AtomicLong();

    public ProvisioningHealthService(ConfigurationAccessor configuration, WorkspaceProbe probe, Duration ttl) {
        this(configuration, probe, ttl, Ticker.systemTicker());
    }

    public ProvisioningHealthService(ConfigurationAccessor configuration, WorkspaceProbe probe, Duration ttl,
                                     Ticker ticker) {
        this.configuration = configuration;
        this.probe = probe;
        this.cache = Caffeine.newBuilder().expireAfterWrite(ttl).ticker(ticker).maximumSize(1).build();
        configuration.addInvalidationListener(this::invalidate);
    }

    public Mono<HealthStatus> health() {
        HealthStatus cached = cache.getIfPresent(KEY);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.defer(() -> {
            long gen = generation.get();
            return configuration.current()
                    .flatMap(this::compute)
                    .doOnNext(status -> {
                        // a write during the computation makes this status stale
                        if (generation.get() == gen) {
                            cache.put(KEY, status);
                        }
                    });
        });
    }

    public void invalidate() {
        generation.incrementAndGet();
        cache.invalidateAll();
    }

    private Mono<HealthStatus> compute(ConfigurationSnapshot config) {
        String workspaceId = config.workspaceId().orElse(null);
        String graphModelId = config.graphModelId().orElse(null);
        if (workspaceId == null) {
            return Mono.just(new HealthStatus(false, false, false, null, graphModelId));
        }
        return probe.reachable(workspaceId)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn(JsonUtils.json(
                            "provisioning_health", "probe_error",
                            "workspaceId", workspaceId,
                            "error_class", e.getClass().getName(),
                            "error_msg", JsonUtils.errorMessage(e, 300)
                    ));
                    return Mono.just(false);
                })
                .map(connected -> new HealthStatus(true, connected, connected && graphModelId != null,
                        workspaceId, graphModelId));
    }
}
