package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.configstore.ConfigKeys;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound provisioning request.
 *
 * @param scenarioId scenario to provision
 * @param overrides  optional parameters, e.g. {@code workspace_id}, {@code capacity_id} or {@code <kind>_name}
 * @param retryFrom  step the caller wants to resume at, as reported by a previous failure event; may be null
 */
public record ProvisioningRequest(String scenarioId, Map<String, String> overrides, String retryFrom) {

    /** Override keys that map onto shared configuration keys. */
    static final Map<String, String> CONFIG_OVERRIDES = Map.of(
            "workspace_id", ConfigKeys.WORKSPACE_ID,
            "capacity_id", ConfigKeys.CAPACITY_ID
    );

    public ProvisioningRequest {
        overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
        retryFrom = retryFrom == null || retryFrom.isBlank() ? null : retryFrom;
    }

    public static ProvisioningRequest of(String scenarioId) {
        return new ProvisioningRequest(scenarioId, Map.of(), null);
    }

    public boolean isRetry() {
        return retryFrom != null;
    }

    /** Overrides translated to configuration keys where a mapping exists; other keys pass through as-is. */
    public Map<String, String> configValues() {
        Map<String, String> values = new LinkedHashMap<>();
        overrides.forEach((k, v) -> {
            if (v != null && !v.isBlank()) values.put(CONFIG_OVERRIDES.getOrDefault(k, k), v);
        });
        return values;
    }
}
