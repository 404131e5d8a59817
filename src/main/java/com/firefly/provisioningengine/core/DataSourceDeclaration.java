package com.firefly.provisioningengine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One named data source of a scenario: the connector that serves it plus opaque
 * connector parameters (database name, container prefix, local data directory...).
 */
public final class DataSourceDeclaration {
    private final String connector;
    private final Map<String, String> params;

    public DataSourceDeclaration(String connector, Map<String, String> params) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static DataSourceDeclaration of(String connector) {
        return new DataSourceDeclaration(connector, Map.of());
    }

    public String connector() { return connector; }

    public Map<String, String> params() { return params; }

    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key)).filter(v -> !v.isBlank());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataSourceDeclaration that)) return false;
        return connector.equals(that.connector) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connector, params);
    }

    @Override
    public String toString() {
        return "DataSourceDeclaration{connector=" + connector + ", params=" + params.keySet() + "}";
    }
}
