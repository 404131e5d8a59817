package com.firefly.provisioningengine.dispatch;

import com.firefly.provisioningengine.exceptions.UnknownConnectorException;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Connector name to backend binding for one category (graph or telemetry). Read-only after construction;
 * lookups are case-insensitive and never touch the network.
 */
public class ConnectorRegistry<B extends QueryBackend> {
    private final String category;
    private final Map<String, B> backends;

    public ConnectorRegistry(String category, Collection<? extends B> backends) {
        this.category = category;
        Map<String, B> byName = new TreeMap<>();
        for (B backend : backends) {
            String name = backend.connector().toLowerCase(Locale.ROOT);
            B previous = byName.putIfAbsent(name, backend);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + category + " connector '" + name + "': "
                        + previous.getClass().getName() + " and " + backend.getClass().getName());
            }
        }
        this.backends = Collections.unmodifiableMap(byName);
    }

    public String category() {
        return category;
    }

    /** @throws UnknownConnectorException if no backend is bound to {@code connector} */
    public B resolve(String connector) {
        B backend = connector == null ? null : backends.get(connector.toLowerCase(Locale.ROOT));
        if (backend == null) {
            throw new UnknownConnectorException(category, connector);
        }
        return backend;
    }

    public Set<String> connectors() {
        return backends.keySet();
    }
}
