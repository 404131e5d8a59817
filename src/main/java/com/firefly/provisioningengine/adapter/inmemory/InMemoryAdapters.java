package com.firefly.provisioningengine.adapter.inmemory;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.configstore.ConfigKeys;

import java.util.List;

/** The standard adapter set on a simulated platform. Finalize is not included; it is platform independent. */
public final class InMemoryAdapters {

    private InMemoryAdapters() {
    }

    public static List<ResourceAdapter> standard(InMemoryResourcePlatform platform) {
        return List.of(workspace(platform), lakehouse(platform), lakehouseFiles(platform), lakehouseTables(platform),
                eventhouse(platform), timeseriesTables(platform), ontology(platform), graphIndex(platform),
                graphModel(platform));
    }

    public static InMemoryResourceAdapter workspace(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.WORKSPACE, platform)
                .id(ConfigKeys.WORKSPACE_ID).name(ConfigKeys.WORKSPACE_NAME).build();
    }

    public static InMemoryResourceAdapter lakehouse(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.LAKEHOUSE, platform)
                .scopedBy(ConfigKeys.WORKSPACE_ID)
                .id(ConfigKeys.LAKEHOUSE_ID).name(ConfigKeys.LAKEHOUSE_NAME).build();
    }

    public static InMemoryResourceAdapter lakehouseFiles(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.LAKEHOUSE_FILES, platform)
                .scopedBy(ConfigKeys.LAKEHOUSE_ID)
                .attribute(ConfigKeys.UPLOADED_FILES, (t, n) -> t.param("entities-dir").orElse("entities"))
                .build();
    }

    public static InMemoryResourceAdapter lakehouseTables(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.LAKEHOUSE_TABLES, platform)
                .scopedBy(ConfigKeys.LAKEHOUSE_ID)
                .attribute(ConfigKeys.LAKEHOUSE_TABLES, (t, n) -> t.param("tables").orElse("*"))
                .build();
    }

    public static InMemoryResourceAdapter eventhouse(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.EVENTHOUSE, platform)
                .scopedBy(ConfigKeys.WORKSPACE_ID)
                .id(ConfigKeys.EVENTHOUSE_ID).name(ConfigKeys.EVENTHOUSE_NAME)
                .attribute(ConfigKeys.KQL_DB_NAME, (t, n) -> t.param("database").orElse(n))
                .attribute(ConfigKeys.EVENTHOUSE_QUERY_URI, (t, n) -> "https://" + n + ".kusto.inmemory.local")
                .build();
    }

    public static InMemoryResourceAdapter timeseriesTables(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.TIMESERIES_TABLES, platform)
                .scopedBy(ConfigKeys.EVENTHOUSE_ID)
                .attribute(ConfigKeys.TELEMETRY_TABLES, (t, n) -> t.param("tables").orElse("*"))
                .build();
    }

    public static InMemoryResourceAdapter ontology(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.ONTOLOGY, platform)
                .scopedBy(ConfigKeys.LAKEHOUSE_ID)
                .id(ConfigKeys.ONTOLOGY_ID).name(ConfigKeys.ONTOLOGY_NAME).build();
    }

    public static InMemoryResourceAdapter graphIndex(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.GRAPH_INDEX, platform)
                .scopedBy(ConfigKeys.ONTOLOGY_ID).build();
    }

    public static InMemoryResourceAdapter graphModel(InMemoryResourcePlatform platform) {
        return InMemoryResourceAdapter.builder(AdapterKeys.GRAPH_MODEL, platform)
                .scopedBy(ConfigKeys.ONTOLOGY_ID)
                .id(ConfigKeys.GRAPH_MODEL_ID).build();
    }
}
