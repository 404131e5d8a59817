package com.firefly.provisioningengine.configstore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the shared configuration at the time it was loaded.
 */
public final class ConfigurationSnapshot {
    private final Map<String, String> values;
    private final Instant loadedAt;

    public ConfigurationSnapshot(Map<String, String> values, Instant loadedAt) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.loadedAt = loadedAt;
    }

    public static ConfigurationSnapshot of(Map<String, String> values) {
        return new ConfigurationSnapshot(values, Instant.now());
    }

    public Map<String, String> values() {
        return values;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(v -> !v.isBlank());
    }

    public Optional<String> workspaceId() {
        return get(ConfigKeys.WORKSPACE_ID);
    }

    public Optional<String> graphModelId() {
        return get(ConfigKeys.GRAPH_MODEL_ID);
    }

    public Optional<String> kqlDatabase() {
        return get(ConfigKeys.KQL_DB_NAME);
    }

    public Optional<String> eventhouseQueryUri() {
        return get(ConfigKeys.EVENTHOUSE_QUERY_URI);
    }

    public Instant loadedAt() {
        return loadedAt;
    }
}
