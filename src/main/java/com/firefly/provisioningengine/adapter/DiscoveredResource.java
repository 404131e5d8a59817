package com.firefly.provisioningengine.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Identifiers an adapter discovered for a resource (platform-assigned ids, names, endpoints),
 * keyed by {@link com.firefly.provisioningengine.configstore.ConfigKeys} names.
 */
public final class DiscoveredResource {
    private static final DiscoveredResource NONE = new DiscoveredResource(Map.of());

    private final Map<String, String> values;

    private DiscoveredResource(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static DiscoveredResource none() {
        return NONE;
    }

    public static DiscoveredResource of(String key, String value) {
        return none().with(key, value);
    }

    public static DiscoveredResource of(Map<String, String> values) {
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return new DiscoveredResource(copy);
    }

    public DiscoveredResource with(String key, String value) {
        if (value == null) return this;
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new DiscoveredResource(copy);
    }

    public Map<String, String> values() {
        return values;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** The first identifier recorded, used as the resource's primary id in logs and results. */
    public String primaryId() {
        return values.isEmpty() ? "" : values.values().iterator().next();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DiscoveredResource that && values.equals(that.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "DiscoveredResource" + values;
    }
}
