package com.firefly.provisioningengine.adapter;

import com.firefly.provisioningengine.configstore.ConfigKeys;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes the identifiers a run discovered to the shared configuration store, which is how the query path
 * picks up newly provisioned resources. "Exists" means every value is already published unchanged.
 */
public class ConfigurationPublishAdapter implements ResourceAdapter {
    private final ConfigurationAccessor configuration;
    private final List<String> keys;

    public ConfigurationPublishAdapter(ConfigurationAccessor configuration) {
        this(configuration, ConfigKeys.PUBLISHED);
    }

    public ConfigurationPublishAdapter(ConfigurationAccessor configuration, List<String> keys) {
        this.configuration = configuration;
        this.keys = List.copyOf(keys);
    }

    @Override
    public String key() {
        return AdapterKeys.CONFIGURATION;
    }

    @Override
    public Mono<DiscoveredResource> exists(ResourceTarget target) {
        Map<String, String> values = publishable(target);
        if (values.isEmpty()) {
            return Mono.just(DiscoveredResource.none());
        }
        return configuration.current()
                .filter(current -> values.entrySet().stream()
                        .allMatch(e -> e.getValue().equals(current.values().get(e.getKey()))))
                .map(current -> DiscoveredResource.of(values));
    }

    @Override
    public Mono<DiscoveredResource> create(ResourceTarget target) {
        Map<String, String> values = publishable(target);
        return configuration.write(values).thenReturn(DiscoveredResource.of(values));
    }

    private Map<String, String> publishable(ResourceTarget target) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : keys) {
            String value = target.discovered().get(key);
            if (value != null && !value.isBlank()) {
                values.put(key, value);
            }
        }
        return values;
    }
}
