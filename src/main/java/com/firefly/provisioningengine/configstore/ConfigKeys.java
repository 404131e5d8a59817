package com.firefly.provisioningengine.configstore;

import java.util.List;

/**
 * Keys of the shared configuration store. Discovered resource identifiers are published under these names
 * by the finalize step and read back by the query backends and the health service.
 */
public final class ConfigKeys {
    public static final String WORKSPACE_ID = "FABRIC_WORKSPACE_ID";
    public static final String WORKSPACE_NAME = "FABRIC_WORKSPACE_NAME";
    public static final String CAPACITY_ID = "FABRIC_CAPACITY_ID";
    public static final String LAKEHOUSE_ID = "FABRIC_LAKEHOUSE_ID";
    public static final String LAKEHOUSE_NAME = "FABRIC_LAKEHOUSE_NAME";
    public static final String EVENTHOUSE_ID = "FABRIC_EVENTHOUSE_ID";
    public static final String EVENTHOUSE_NAME = "FABRIC_EVENTHOUSE_NAME";
    public static final String KQL_DB_ID = "FABRIC_KQL_DB_ID";
    public static final String KQL_DB_NAME = "FABRIC_KQL_DB_NAME";
    public static final String EVENTHOUSE_QUERY_URI = "EVENTHOUSE_QUERY_URI";
    public static final String ONTOLOGY_ID = "FABRIC_ONTOLOGY_ID";
    public static final String ONTOLOGY_NAME = "FABRIC_ONTOLOGY_NAME";
    public static final String GRAPH_MODEL_ID = "FABRIC_GRAPH_MODEL_ID";
    public static final String UPLOADED_FILES = "FABRIC_UPLOADED_FILES";
    public static final String LAKEHOUSE_TABLES = "FABRIC_LAKEHOUSE_TABLES";
    public static final String TELEMETRY_TABLES = "FABRIC_TELEMETRY_TABLES";

    /** Keys the finalize step publishes when they were discovered. */
    public static final List<String> PUBLISHED = List.of(
            WORKSPACE_ID, WORKSPACE_NAME, LAKEHOUSE_ID, LAKEHOUSE_NAME, EVENTHOUSE_ID, KQL_DB_NAME,
            EVENTHOUSE_QUERY_URI, ONTOLOGY_ID, ONTOLOGY_NAME, GRAPH_MODEL_ID);

    private ConfigKeys() {
    }
}
