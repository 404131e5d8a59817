package com.firefly.provisioningengine.dispatch.fabric;

import com.fasterxml.jackson.databind.JsonNode;
import com.firefly.provisioningengine.adapter.fabric.FabricApiException;
import com.firefly.provisioningengine.adapter.fabric.FabricRestClient;
import com.firefly.provisioningengine.configstore.ConfigurationAccessor;
import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.dispatch.GraphBackend;
import com.firefly.provisioningengine.dispatch.QueryColumn;
import com.firefly.provisioningengine.dispatch.QueryRequest;
import com.firefly.provisioningengine.dispatch.QueryResult;
import com.firefly.provisioningengine.exceptions.ProvisioningException;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GQL queries against a Fabric graph model ({@code /workspaces/{ws}/GraphModels/{id}/executeQuery}).
 * <p>
 * Workspace and graph model ids are read from the shared configuration on every call. Throttling (429) and the
 * engine's {@code ColdStartTimeout} are retried with exponential backoff.
 */
public class FabricGqlBackend implements GraphBackend {
    private static final Logger log = LoggerFactory.getLogger(FabricGqlBackend.class);

    static final String COLD_START = "ColdStartTimeout";

    private final FabricRestClient client;
    private final ConfigurationAccessor configuration;
    private final int maxRetries;
    private final Duration backoff;

    public FabricGqlBackend(FabricRestClient client, ConfigurationAccessor configuration,
                            int maxRetries, Duration backoff) {
        this.client = client;
        this.configuration = configuration;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    @Override
    public String connector() {
        return Connectors.FABRIC_GQL;
    }

    @Override
    public Mono<QueryResult> query(QueryRequest request, DataSourceDeclaration dataSource) {
        return configuration.current().flatMap(config -> {
            String workspaceId = config.workspaceId().orElse(null);
            String graphModelId = config.graphModelId().orElse(null);
            if (workspaceId == null || graphModelId == null) {
                return Mono.error(new ProvisioningException(
                        "Fabric backend not configured: FABRIC_WORKSPACE_ID and FABRIC_GRAPH_MODEL_ID are required"));
            }
            String path = "/workspaces/" + workspaceId + "/GraphModels/" + graphModelId + "/executeQuery?beta=true";
            return Mono.defer(() -> client.post(path, Map.of("query", request.query())))
                    .retryWhen(Retry.backoff(maxRetries, backoff)
                            .filter(FabricGqlBackend::isRetryable)
                            .doBeforeRetry(signal -> log.warn(JsonUtils.json(
                                    "fabric_gql", "retry",
                                    "attempt", Long.toString(signal.totalRetries() + 1),
                                    "error_msg", JsonUtils.errorMessage(signal.failure(), 200)
                            )))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .map(response -> toResult(response.body()));
        });
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof FabricApiException fe) {
            return fe.getStatus() == 429
                    || (fe.getStatus() == 500 && String.valueOf(fe.getMessage()).contains(COLD_START));
        }
        return false;
    }

    static QueryResult toResult(JsonNode body) {
        JsonNode result = body.has("result") ? body.path("result") : body;
        List<QueryColumn> columns = new ArrayList<>();
        for (JsonNode col : result.path("columns")) {
            columns.add(col.isTextual()
                    ? QueryColumn.of(col.asText())
                    : new QueryColumn(col.path("name").asText(), col.path("type").asText("string")));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode row : result.path("data")) {
            Map<String, Object> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = row.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                values.put(f.getKey(), f.getValue());
            }
            rows.add(values);
        }
        if (columns.isEmpty() && !rows.isEmpty()) {
            rows.get(0).keySet().forEach(name -> columns.add(QueryColumn.of(name)));
        }
        return QueryResult.of(columns, rows);
    }
}
