package com.firefly.provisioningengine.adapter;

/**
 * Keys under which the standard resource adapters are registered.
 */
public final class AdapterKeys {
    public static final String WORKSPACE = "workspace";
    public static final String LAKEHOUSE = "lakehouse";
    public static final String LAKEHOUSE_FILES = "lakehouse-files";
    public static final String LAKEHOUSE_TABLES = "lakehouse-tables";
    public static final String EVENTHOUSE = "eventhouse";
    public static final String TIMESERIES_TABLES = "timeseries-tables";
    public static final String ONTOLOGY = "ontology";
    public static final String GRAPH_INDEX = "graph-index";
    public static final String GRAPH_MODEL = "graph-model";
    public static final String CONFIGURATION = "configuration";

    private AdapterKeys() {
    }
}
