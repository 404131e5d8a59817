package com.firefly.provisioningengine.dispatch.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.fabric.KustoRestClient;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.dispatch.QueryColumn;
import com.firefly.provisioningengine.dispatch.QueryRequest;
import com.firefly.provisioningengine.dispatch.QueryResult;
import com.firefly.provisioningengine.dispatch.TelemetryBackend;
import com.firefly.provisioningengine.exceptions.ProvisioningException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * KQL queries against the provisioned eventhouse. The query URI and database come from shared configuration; a
 * {@code database} data-source parameter overrides the database.
 */
public class FabricKqlBackend implements TelemetryBackend {
    private final KustoRestClient kusto;
    private final ConfigurationAccessor configuration;

    public FabricKqlBackend(KustoRestClient kusto, ConfigurationAccessor configuration) {
        this.kusto = kusto;
        this.configuration = configuration;
    }

    @Override
    public String connector() {
        return Connectors.FABRIC_KQL;
    }

    @Override
    public Mono<QueryResult> query(QueryRequest request, DataSourceDeclaration dataSource) {
        return configuration.current().flatMap(config -> {
            String uri = config.eventhouseQueryUri().orElse(null);
            String database = dataSource.param("database").or(config::kqlDatabase).orElse(null);
            if (uri == null || database == null) {
                return Mono.error(new ProvisioningException(
                        "Eventhouse not configured: EVENTHOUSE_QUERY_URI and FABRIC_KQL_DB_NAME are required"));
            }
            return kusto.query(uri, database, request.query()).map(FabricKqlBackend::toResult);
        });
    }

    static QueryResult toResult(KustoRestClient.KustoTable table) {
        List<QueryColumn> columns = new ArrayList<>();
        for (int i = 0; i < table.columnNames().size(); i++) {
            columns.add(new QueryColumn(table.columnNames().get(i), table.columnTypes().get(i)));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode row : table.rows()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i).name(), row.path(i));
            }
            rows.add(values);
        }
        return QueryResult.of(columns, rows);
    }
}
