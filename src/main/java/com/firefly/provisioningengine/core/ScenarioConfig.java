package com.firefly.provisioningengine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a scenario's configuration for one run.
 * <p>
 * Re-resolving a scenario always produces a new instance; nothing mutates a snapshot in place.
 * Data sources are keyed by category ({@link #GRAPH}, {@link #TELEMETRY}, ...).
 */
public final class ScenarioConfig {

    public static final String GRAPH = "graph";
    public static final String TELEMETRY = "telemetry";

    private final String scenarioId;
    private final Map<String, DataSourceDeclaration> dataSources;

    public ScenarioConfig(String scenarioId, Map<String, DataSourceDeclaration> dataSources) {
        this.scenarioId = Objects.requireNonNull(scenarioId, "scenarioId");
        this.dataSources = dataSources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dataSources));
    }

    public static Builder builder(String scenarioId) {
        return new Builder(scenarioId);
    }

    public String scenarioId() { return scenarioId; }

    public Map<String, DataSourceDeclaration> dataSources() { return dataSources; }

    public Optional<DataSourceDeclaration> dataSource(String category) {
        return Optional.ofNullable(dataSources.get(category));
    }

    /** Connector name declared for the category, if any. */
    public Optional<String> connector(String category) {
        return dataSource(category).map(DataSourceDeclaration::connector);
    }

    public boolean declares(String category, String connector) {
        return connector(category).map(c -> c.equalsIgnoreCase(connector)).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScenarioConfig that)) return false;
        return scenarioId.equals(that.scenarioId) && dataSources.equals(that.dataSources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scenarioId, dataSources);
    }

    @Override
    public String toString() {
        return "ScenarioConfig{scenarioId=" + scenarioId + ", dataSources=" + dataSources + "}";
    }

    public static final class Builder {
        private final String scenarioId;
        private final Map<String, DataSourceDeclaration> dataSources = new LinkedHashMap<>();

        private Builder(String scenarioId) {
            this.scenarioId = scenarioId;
        }

        public Builder dataSource(String category, String connector) {
            return dataSource(category, connector, Map.of());
        }

        public Builder dataSource(String category, String connector, Map<String, String> params) {
            dataSources.put(category, new DataSourceDeclaration(connector, params));
            return this;
        }

        public ScenarioConfig build() {
            return new ScenarioConfig(scenarioId, dataSources);
        }
    }
}
