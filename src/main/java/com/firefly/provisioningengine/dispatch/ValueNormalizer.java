package com.firefly.provisioningengine.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Makes backend values safe for a flat JSON table: temporals become ISO-8601 UTC strings, {@link JsonNode}s
 * become plain values, nested objects and arrays become JSON strings.
 */
public class ValueNormalizer {
    private final ObjectMapper mapper;

    public ValueNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public QueryResult normalize(QueryResult result) {
        if (result.isError()) {
            return result;
        }
        List<Map<String, Object>> rows = new ArrayList<>(result.rows().size());
        for (Map<String, Object> row : result.rows()) {
            Map<String, Object> out = new LinkedHashMap<>();
            row.forEach((k, v) -> out.put(k, normalize(v)));
            rows.add(out);
        }
        return new QueryResult(result.columns(), rows, null);
    }

    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return fromJson(node);
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant().toString();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant().toString();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC).toString();
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            return toJson(value);
        }
        return value.toString();
    }

    private Object fromJson(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return toJson(node);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
