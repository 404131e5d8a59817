package com.firefly.provisioningengine.adapter;

import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.PermanentAdapterException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a step operates on. Derived deterministically from the scenario and step identifiers, so a re-run
 * of the same step checks for, and creates, exactly the same resource.
 * <p>
 * {@link #values()} layers shared configuration, request overrides and identifiers discovered by earlier
 * steps of the run (in that order of precedence, lowest first).
 */
public final class ResourceTarget {
    private final ScenarioConfig scenario;
    private final String runId;
    private final String stepId;
    private final String resourceKind;
    private final String name;
    private final Map<String, String> values;
    private final Map<String, String> discovered;
    private final DataSourceDeclaration dataSource;

    public ResourceTarget(ScenarioConfig scenario,
                          String runId,
                          String stepId,
                          String resourceKind,
                          String name,
                          Map<String, String> values,
                          DataSourceDeclaration dataSource) {
        this(scenario, runId, stepId, resourceKind, name, values, Map.of(), dataSource);
    }

    public ResourceTarget(ScenarioConfig scenario,
                          String runId,
                          String stepId,
                          String resourceKind,
                          String name,
                          Map<String, String> values,
                          Map<String, String> discovered,
                          DataSourceDeclaration dataSource) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.runId = runId;
        this.stepId = stepId;
        this.resourceKind = resourceKind;
        this.name = name;
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.discovered = discovered == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(discovered));
        this.dataSource = dataSource;
    }

    public ScenarioConfig scenario() { return scenario; }

    public String scenarioId() { return scenario.scenarioId(); }

    public String runId() { return runId; }

    public String stepId() { return stepId; }

    public String resourceKind() { return resourceKind; }

    /** Display name of the target resource. */
    public String name() { return name; }

    public Map<String, String> values() { return values; }

    /** Only the identifiers discovered by earlier steps of this run (and of the run it resumed). */
    public Map<String, String> discovered() { return discovered; }

    public Optional<String> value(String key) {
        return Optional.ofNullable(values.get(key)).filter(v -> !v.isBlank());
    }

    /**
     * Identifier that an earlier step must have discovered.
     *
     * @throws PermanentAdapterException when missing; this indicates a broken dependency chain
     */
    public String require(String key) {
        return value(key).orElseThrow(() -> new PermanentAdapterException(
                "Step '" + stepId + "' requires " + key + " but no earlier step discovered it"));
    }

    public Optional<DataSourceDeclaration> dataSource() {
        return Optional.ofNullable(dataSource);
    }

    public Optional<String> param(String key) {
        return dataSource().flatMap(ds -> ds.param(key));
    }

    public String requireParam(String key) {
        return param(key).orElseThrow(() -> new PermanentAdapterException(
                "Step '" + stepId + "' requires data-source parameter '" + key + "'"));
    }

    @Override
    public String toString() {
        return "ResourceTarget{scenario=" + scenarioId() + ", step=" + stepId + ", kind=" + resourceKind
                + ", name=" + name + "}";
    }
}
