package com.firefly.provisioningengine.registry;

import com.firefly.provisioningengine.core.ScenarioConfig;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable description of one provisioning step: identity, dependencies, when it is active, which adapter
 * performs it and how its progress is reported. Built through {@link StepGraphBuilder}.
 */
public class StepDefinition {
    public final String id;
    public final List<String> dependsOn;
    public final Predicate<ScenarioConfig> activation;
    public final String adapter;
    public final ProgressBand band;
    public final String label;
    public final String doneLabel;
    /** Kind of platform resource the step targets; drives deterministic resource naming. */
    public final String resourceKind;
    /** Data-source category whose parameters the adapter receives, or null. */
    public final String dataSource;
    public final int retry;
    public final Duration backoff;
    public final Duration timeout;

    public StepDefinition(String id,
                          List<String> dependsOn,
                          Predicate<ScenarioConfig> activation,
                          String adapter,
                          ProgressBand band,
                          String label,
                          String doneLabel,
                          String resourceKind,
                          String dataSource,
                          int retry,
                          Duration backoff,
                          Duration timeout) {
        this.id = id;
        this.dependsOn = List.copyOf(dependsOn);
        this.activation = activation;
        this.adapter = adapter;
        this.band = band;
        this.label = label;
        this.doneLabel = doneLabel;
        this.resourceKind = resourceKind;
        this.dataSource = dataSource;
        this.retry = retry;
        this.backoff = backoff;
        this.timeout = timeout;
    }

    public boolean isActive(ScenarioConfig config) {
        return activation.test(config);
    }

    @Override
    public String toString() {
        return "StepDefinition{" + id + " <- " + dependsOn + ", adapter=" + adapter + ", band=" + band + "}";
    }
}
