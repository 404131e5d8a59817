package com.firefly.provisioningengine.scenario;

import com.firefly.provisioningengine.core.ScenarioConfig;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Resolves a scenario identifier to a fresh {@link ScenarioConfig} snapshot.
 * Unknown or malformed identifiers fail with {@link com.firefly.provisioningengine.exceptions.ValidationException}.
 */
public interface ScenarioCatalog {

    Mono<ScenarioConfig> resolve(String scenarioId);

    Set<String> scenarioIds();
}
