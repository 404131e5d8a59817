package com.firefly.provisioningengine.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ValueNormalizer normalizer = new ValueNormalizer(mapper);

    @Test
    void temporalsBecomeIsoUtcStrings() {
        assertEquals("2024-01-01T00:00:00Z", normalizer.normalize(Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals("2024-01-01T00:00:00Z",
                normalizer.normalize(OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.ofHours(10))));
        assertEquals("2024-01-01T00:00:00Z", normalizer.normalize(LocalDateTime.of(2024, 1, 1, 0, 0)));
    }

    @Test
    void jsonNodesBecomePlainValues() throws Exception {
        assertEquals("x", normalizer.normalize(mapper.readTree("\"x\"")));
        assertEquals(Boolean.TRUE, normalizer.normalize(mapper.readTree("true")));
        assertEquals(3, ((Number) normalizer.normalize(mapper.readTree("3"))).intValue());
        assertNull(normalizer.normalize(mapper.readTree("null")));
        assertEquals("{\"a\":[1,2]}", normalizer.normalize(mapper.readTree("{\"a\":[1,2]}")));
    }

    @Test
    void nestedCollectionsAreSerialized() {
        assertEquals("[1,2]", normalizer.normalize(List.of(1, 2)));
        assertEquals("{\"k\":\"v\"}", normalizer.normalize(Map.of("k", "v")));
    }

    @Test
    void errorResultsPassThroughUntouched() {
        QueryResult error = QueryResult.error("bad query");

        assertSame(error, normalizer.normalize(error));
    }

    @Test
    void everyRowValueIsNormalized() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("at", Instant.parse("2024-01-01T00:00:00Z"));
        row.put("n", null);

        QueryResult result = normalizer.normalize(QueryResult.of(List.of(QueryColumn.of("at"), QueryColumn.of("n")),
                List.of(row)));

        assertEquals("2024-01-01T00:00:00Z", result.rows().get(0).get("at"));
        assertTrue(result.rows().get(0).containsKey("n"));
    }
}
