package com.firefly.provisioningengine.scenario;

import com.firefly.provisioningengine.config.ProvisioningEngineProperties;
import com.firefly.provisioningengine.core.ScenarioConfig;
import com.firefly.provisioningengine.exceptions.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scenario catalog bound from {@code firefly.provisioning.scenarios.<id>.data-sources.<category>.*}.
 */
public class PropertiesScenarioCatalog extends MapScenarioCatalog {

    public PropertiesScenarioCatalog(ProvisioningEngineProperties properties) {
        super(toConfigs(properties.getScenarios()));
    }

    static Map<String, ScenarioConfig> toConfigs(Map<String, ProvisioningEngineProperties.ScenarioProperties> scenarios) {
        Map<String, ScenarioConfig> configs = new LinkedHashMap<>();
        scenarios.forEach((id, scenario) -> {
            ScenarioConfig.Builder builder = ScenarioConfig.builder(id);
            scenario.getDataSources().forEach((category, ds) -> {
                if (ds.getConnector() == null || ds.getConnector().isBlank()) {
                    throw new ValidationException(
                            "Scenario '" + id + "' data source '" + category + "' has no connector");
                }
                builder.dataSource(category, ds.getConnector().trim(), ds.getParams());
            });
            configs.put(id, builder.build());
        });
        return configs;
    }
}
