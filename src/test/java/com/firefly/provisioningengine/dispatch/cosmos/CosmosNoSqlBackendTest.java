package com.firefly.provisioningengine.dispatch.cosmos;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.provisioningengine.dispatch.QueryResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CosmosNoSqlBackendTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void systemFieldsAreDroppedAndColumnsUnioned() throws Exception {
        QueryResult result = CosmosNoSqlBackend.toResult(List.of(
                mapper.readTree("{\"id\":\"1\",\"latency\":12,\"_rid\":\"x\",\"_ts\":1700000000}"),
                mapper.readTree("{\"id\":\"2\",\"jitter\":3,\"_etag\":\"e\"}")));

        assertEquals(List.of("id", "latency", "jitter"),
                result.columns().stream().map(c -> c.name()).toList());
        assertFalse(result.rows().get(0).containsKey("_rid"));
        assertFalse(result.rows().get(1).containsKey("latency"));
    }

    @Test
    void scalarItemsBecomeAValueColumn() throws Exception {
        QueryResult result = CosmosNoSqlBackend.toResult(List.of(mapper.readTree("42")));

        assertEquals("value", result.columns().get(0).name());
        assertEquals(1, result.rows().size());
    }
}
