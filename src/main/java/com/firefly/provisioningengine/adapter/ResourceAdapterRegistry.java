package com.firefly.provisioningengine.adapter;

import com.firefly.provisioningengine.exceptions.PermanentAdapterException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Adapters by key, collected from the application context at startup.
 */
public class ResourceAdapterRegistry {
    private final Map<String, ResourceAdapter> adapters;

    public ResourceAdapterRegistry(Collection<? extends ResourceAdapter> adapters) {
        Map<String, ResourceAdapter> byKey = new LinkedHashMap<>();
        for (ResourceAdapter adapter : adapters) {
            ResourceAdapter previous = byKey.putIfAbsent(adapter.key(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate resource adapter key '" + adapter.key() + "': "
                        + previous.getClass().getName() + " and " + adapter.getClass().getName());
            }
        }
        this.adapters = Collections.unmodifiableMap(byKey);
    }

    public Optional<ResourceAdapter> find(String key) {
        return Optional.ofNullable(adapters.get(key));
    }

    public ResourceAdapter resolve(String key) {
        return find(key).orElseThrow(() -> new PermanentAdapterException("No resource adapter registered for '" + key + "'"));
    }

    public Map<String, ResourceAdapter> adapters() {
        return adapters;
    }
}
