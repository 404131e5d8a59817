package com.firefly.provisioningengine.core;

/**
 * Well-known connector names used in scenario data-source declarations.
 */
public final class Connectors {
    public static final String FABRIC_GQL = "fabric-gql";
    public static final String FABRIC_KQL = "fabric-kql";
    public static final String COSMOSDB_NOSQL = "cosmosdb-nosql";
    public static final String MOCK = "mock";

    private Connectors() {
    }
}
