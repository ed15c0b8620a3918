package org.lite.ai.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fingerprints for the response cache. Identical inputs give identical keys regardless of map ordering.
 */
public final class CacheKeys {

    public static final String PREFIX = "sha256:";

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private CacheKeys() {
    }

    public static String fingerprint(String templateName, String templateVersion, Map<String, ?> variables,
                                     String model, Map<String, ?> params) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("template", templateName);
        canonical.put("templateVersion", templateVersion);
        canonical.put("variables", variables == null ? Map.of() : variables);
        canonical.put("model", model);
        canonical.put("params", params == null ? Map.of() : params);
        try {
            return PREFIX + ContentHashes.sha256Hex(CANONICAL.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key inputs are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
