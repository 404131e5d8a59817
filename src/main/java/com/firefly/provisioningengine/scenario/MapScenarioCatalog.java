package com.firefly.provisioningengine.scenario;

import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.ValidationException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Catalog over already-materialized scenario manifests, typically bound from
 * {@code firefly.provisioning.scenarios.*}.
 */
public class MapScenarioCatalog implements ScenarioCatalog {
    private final Map<String, ScenarioConfig> scenarios;

    public MapScenarioCatalog(Map<String, ScenarioConfig> scenarios) {
        Map<String, ScenarioConfig> copy = new LinkedHashMap<>();
        scenarios.forEach((id, cfg) -> copy.put(ScenarioIds.requireValid(id), cfg));
        this.scenarios = Collections.unmodifiableMap(copy);
    }

    @Override
    public Mono<ScenarioConfig> resolve(String scenarioId) {
        return Mono.fromCallable(() -> {
            ScenarioIds.requireValid(scenarioId);
            ScenarioConfig config = scenarios.get(scenarioId);
            if (config == null) {
                throw new ValidationException("Unknown scenario '" + scenarioId + "'");
            }
            // fresh snapshot per resolution
            return new ScenarioConfig(config.scenarioId(), config.dataSources());
        });
    }

    @Override
    public Set<String> scenarioIds() {
        return scenarios.keySet();
    }
}
