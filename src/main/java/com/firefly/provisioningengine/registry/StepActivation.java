package com.firefly.provisioningengine.registry;

import com.firefly.provisioningengine.core.ScenarioConfig;

import java.util.function.Predicate;

/**
 * Activation predicates for steps. Each is a pure function of the {@link ScenarioConfig}.
 */
public final class StepActivation {

    private StepActivation() {
    }

    public static Predicate<ScenarioConfig> always() {
        return config -> true;
    }

    /** Active when the scenario binds {@code category} to {@code connector} (case-insensitive). */
    public static Predicate<ScenarioConfig> connector(String category, String connector) {
        return config -> config.declares(category, connector);
    }

    public static Predicate<ScenarioConfig> graphConnector(String connector) {
        return connector(ScenarioConfig.GRAPH, connector);
    }

    public static Predicate<ScenarioConfig> telemetryConnector(String connector) {
        return connector(ScenarioConfig.TELEMETRY, connector);
    }
}
