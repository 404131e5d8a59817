package com.firefly.provisioningengine.dispatch.cosmos;

import com.azure.cosmos.CosmosAsyncClient;
import com.azure.cosmos.models.CosmosQueryRequestOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.dispatch.GraphBackend;
import com.firefly.provisioningengine.dispatch.QueryColumn;
import com.firefly.provisioningengine.dispatch.QueryRequest;
import com.firefly.provisioningengine.dispatch.QueryResult;
import com.firefly.provisioningengine.dispatch.TelemetryBackend;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQL queries against a Cosmos DB NoSQL container named by the data-source parameters {@code database} and
 * {@code container}. System properties ({@code _rid}, {@code _etag}, ...) are dropped from the result.
 */
public class CosmosNoSqlBackend implements GraphBackend, TelemetryBackend {
    private static final Set<String> SYSTEM_FIELDS = Set.of("_rid", "_self", "_etag", "_attachments", "_ts");

    private final CosmosAsyncClient client;
    private final String defaultDatabase;
    private final int maxItems;

    public CosmosNoSqlBackend(CosmosAsyncClient client, String defaultDatabase, int maxItems) {
        this.client = client;
        this.defaultDatabase = defaultDatabase;
        this.maxItems = maxItems;
    }

    @Override
    public String connector() {
        return Connectors.COSMOSDB_NOSQL;
    }

    @Override
    public Mono<QueryResult> query(QueryRequest request, DataSourceDeclaration dataSource) {
        String database = dataSource.param("database").orElse(defaultDatabase);
        String container = dataSource.param("container")
                .orElseGet(() -> dataSource.param("container-prefix").orElse(request.scenarioId()) + "-telemetry");
        return client.getDatabase(database)
                .getContainer(container)
                .queryItems(request.query(), new CosmosQueryRequestOptions(), JsonNode.class)
                .take(maxItems)
                .collectList()
                .map(CosmosNoSqlBackend::toResult);
    }

    static QueryResult toResult(List<JsonNode> items) {
        Set<String> names = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode item : items) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (item.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> f = fields.next();
                    if (!SYSTEM_FIELDS.contains(f.getKey())) {
                        names.add(f.getKey());
                        row.put(f.getKey(), f.getValue());
                    }
                }
            } else {
                names.add("value");
                row.put("value", item);
            }
            rows.add(row);
        }
        return QueryResult.of(names.stream().map(QueryColumn::of).toList(), rows);
    }
}
