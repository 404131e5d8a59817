package com.firefly.provisioningengine.registry;

import com.firefly.provisioningengine.adapter.AdapterKeys;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.ScenarioConfig;

import java.time.Duration;

import static com.firefly.provisioningengine.registry.StepActivation.always;
import static com.firefly.provisioningengine.registry.StepActivation.graphConnector;
import static com.firefly.provisioningengine.registry.StepActivation.telemetryConnector;

/**
 * The provisioning pipeline for a Fabric-backed scenario: one step per progress band.
 * <p>
 * Graph steps are active when the scenario's graph connector is {@code fabric-gql}; time-series steps when the
 * telemetry connector is {@code fabric-kql}. A scenario that routes telemetry elsewhere (e.g. Cosmos DB)
 * simply selects no time-series steps.
 */
public final class StandardStepGraph {

    public static final String NAME = "fabric";

    public static final String WORKSPACE = "workspace";
    public static final String STORAGE = "storage";
    public static final String UPLOAD = "upload";
    public static final String TABLES = "tables";
    public static final String TIMESERIES_DB = "timeseries-db";
    public static final String TIMESERIES_INGEST = "timeseries-ingest";
    public static final String ONTOLOGY_BUILD = "ontology-build";
    public static final String INDEXING_WAIT = "indexing-wait";
    public static final String MODEL_DISCOVERY = "model-discovery";
    public static final String FINALIZE = "finalize";

    private StandardStepGraph() {
    }

    public static StepGraph create() {
        return create(0, null);
    }

    /**
     * @param retry   automatic retries for transient failures on every step
     * @param backoff initial backoff between those retries, or null for immediate retry
     */
    public static StepGraph create(int retry, Duration backoff) {
        return StepGraphBuilder.graph(NAME)
                .step(WORKSPACE)
                    .band(ProgressBand.WORKSPACE).adapter(AdapterKeys.WORKSPACE).resourceKind("workspace")
                    .label("Setting up workspace...").doneLabel("Workspace ready")
                    .activeWhen(always()).retry(retry).backoff(backoff).add()
                .step(STORAGE).dependsOn(WORKSPACE)
                    .band(ProgressBand.STORAGE_PREP).adapter(AdapterKeys.LAKEHOUSE).resourceKind("lakehouse")
                    .label("Preparing data storage...").doneLabel("Lakehouse ready")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(UPLOAD).dependsOn(STORAGE)
                    .band(ProgressBand.BULK_UPLOAD).adapter(AdapterKeys.LAKEHOUSE_FILES).resourceKind("lakehouse")
                    .label("Uploading graph data...").doneLabel("Graph data uploaded")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(TABLES).dependsOn(UPLOAD)
                    .band(ProgressBand.TABLE_MATERIALIZATION).adapter(AdapterKeys.LAKEHOUSE_TABLES).resourceKind("lakehouse")
                    .label("Configuring data tables...").doneLabel("Delta tables loaded")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(TIMESERIES_DB).dependsOn(WORKSPACE)
                    .band(ProgressBand.TIMESERIES_DB).adapter(AdapterKeys.EVENTHOUSE).resourceKind("eventhouse")
                    .label("Setting up telemetry database...").doneLabel("Eventhouse ready")
                    .dataSource(ScenarioConfig.TELEMETRY)
                    .activeWhen(telemetryConnector(Connectors.FABRIC_KQL)).retry(retry).backoff(backoff).add()
                .step(TIMESERIES_INGEST).dependsOn(TIMESERIES_DB)
                    .band(ProgressBand.TIMESERIES_INGEST).adapter(AdapterKeys.TIMESERIES_TABLES).resourceKind("eventhouse")
                    .label("Loading telemetry data...").doneLabel("Telemetry data loaded")
                    .dataSource(ScenarioConfig.TELEMETRY)
                    .activeWhen(telemetryConnector(Connectors.FABRIC_KQL)).retry(retry).backoff(backoff).add()
                .step(ONTOLOGY_BUILD).dependsOn(TABLES)
                    .band(ProgressBand.ONTOLOGY_BUILD).adapter(AdapterKeys.ONTOLOGY).resourceKind("ontology")
                    .label("Building graph ontology...").doneLabel("Ontology definition applied")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(INDEXING_WAIT).dependsOn(ONTOLOGY_BUILD)
                    .band(ProgressBand.INDEXING_WAIT).adapter(AdapterKeys.GRAPH_INDEX).resourceKind("ontology")
                    .label("Indexing, this may take a minute...").doneLabel("Ontology indexed")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(MODEL_DISCOVERY).dependsOn(INDEXING_WAIT)
                    .band(ProgressBand.MODEL_DISCOVERY).adapter(AdapterKeys.GRAPH_MODEL).resourceKind("ontology")
                    .label("Discovering graph model...").doneLabel("Graph model discovered")
                    .dataSource(ScenarioConfig.GRAPH)
                    .activeWhen(graphConnector(Connectors.FABRIC_GQL)).retry(retry).backoff(backoff).add()
                .step(FINALIZE).dependsOn(WORKSPACE)
                    .band(ProgressBand.FINALIZE).adapter(AdapterKeys.CONFIGURATION).resourceKind("configuration")
                    .label("Almost done...").doneLabel("Configuration saved")
                    .activeWhen(always()).retry(retry).backoff(backoff).add()
                .build();
    }
}
