package com.firefly.provisioningengine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the single-line JSON log records used across the engine, e.g.
 * <pre>{"provisioning_step":"created","scenario":"telco-noc","runId":"...","stepId":"workspace"}</pre>
 */
public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {
    }

    /**
     * Builds a flat JSON object from alternating keys and values. Null values are rendered as empty strings.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static String json(String... keyValuePairs) {
        if (keyValuePairs == null || keyValuePairs.length == 0) return "{}";
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be provided in pairs (even number of arguments)");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            String value = keyValuePairs[i + 1];
            map.put(keyValuePairs[i], value != null ? value : "");
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.error("Failed to create JSON from key-value pairs", e);
            return "{}";
        }
    }

    public static String safeString(String s, int max) {
        if (s == null) return "";
        if (max <= 0) return "";
        if (s.length() <= max) return s;
        return s.substring(0, Math.max(0, max - 3)) + "...";
    }

    /** Best-effort {@code toString} preview, truncated to {@code max} characters. */
    public static String summarize(Object obj, int max) {
        if (obj == null) return "null";
        String s;
        try {
            s = String.valueOf(obj);
        } catch (RuntimeException e) {
            s = obj.getClass().getName();
        }
        return safeString(s, max);
    }

    public static String errorMessage(Throwable error, int max) {
        if (error == null) return "";
        String msg = error.getMessage();
        return safeString(msg != null ? msg : error.getClass().getSimpleName(), max);
    }
}
