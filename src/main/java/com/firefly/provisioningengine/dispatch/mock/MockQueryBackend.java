package com.firefly.provisioningengine.dispatch.mock;

import com.firefly.provisioningengine.core.Connectors;
import com.firefly.provisioningengine.core.DataSourceDeclaration;
import com.firefly.provisioningengine.dispatch.GraphBackend;
import com.firefly.provisioningengine.dispatch.QueryColumn;
import com.firefly.provisioningengine.dispatch.QueryRequest;
import com.firefly.provisioningengine.dispatch.QueryResult;
import com.firefly.provisioningengine.dispatch.TelemetryBackend;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Canned rows for demos and tests; the query text is echoed back in every row. */
public class MockQueryBackend implements GraphBackend, TelemetryBackend {

    @Override
    public String connector() {
        return Connectors.MOCK;
    }

    @Override
    public Mono<QueryResult> query(QueryRequest request, DataSourceDeclaration dataSource) {
        List<QueryColumn> columns = List.of(
                QueryColumn.of("id"), QueryColumn.of("label"), new QueryColumn("observed_at", "datetime"),
                QueryColumn.of("query"));
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return Mono.just(QueryResult.of(columns, List.of(
                row("CORE-SYD-01", "CoreRouter", now, request.query()),
                row("LINK-SYD-MEL-01", "TransportLink", now.plusSeconds(60), request.query()))));
    }

    private static Map<String, Object> row(String id, String label, Instant at, String query) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("label", label);
        row.put("observed_at", at);
        row.put("query", query);
        return row;
    }
}
