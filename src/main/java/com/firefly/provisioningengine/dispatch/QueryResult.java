package com.firefly.provisioningengine.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Tabular query result. Query failures are carried in {@code error} with empty columns and rows, so callers
 * can show the message and let the user fix the query.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(List<QueryColumn> columns, List<Map<String, Object>> rows, String error) {

    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : rows;
    }

    public static QueryResult of(List<QueryColumn> columns, List<Map<String, Object>> rows) {
        return new QueryResult(columns, rows, null);
    }

    public static QueryResult error(String message) {
        return new QueryResult(List.of(), List.of(), message);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
