package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.registry.StepDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/** Builds the {@link ResourceTarget} a step operates on from the run's current state. */
public class TargetResolver {
    private final ResourceNaming naming;

    public TargetResolver(ResourceNaming naming) {
        this.naming = naming;
    }

    public ResourceTarget resolve(RunState state, StepDefinition step) {
        Map<String, String> discovered = state.discoveredValues();
        Map<String, String> values = new LinkedHashMap<>(state.baseValues());
        values.putAll(discovered);
        DataSourceDeclaration dataSource = step.dataSource == null
                ? null
                : state.config().dataSource(step.dataSource).orElse(null);
        String name = naming.nameFor(step.resourceKind, state.scenarioId(), state.overrides());
        return new ResourceTarget(state.config(), state.runId(), step.id, step.resourceKind, name,
                values, discovered, dataSource);
    }
}
