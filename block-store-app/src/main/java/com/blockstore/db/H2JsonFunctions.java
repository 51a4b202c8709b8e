package com.blockstore.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Java functions registered as H2 aliases by {@code schema-h2.sql}. They give
 * the embedded database the JSON path reads PostgreSQL has natively.
 */
public final class H2JsonFunctions {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> PATH_TYPE = new TypeReference<>() {};

    private H2JsonFunctions() {
    }

    /**
     * Same result as PostgreSQL's {@code json #>> path}: scalars as text,
     * objects and arrays as JSON, NULL for a missing path or a JSON null.
     *
     * @param json     stored document, may be null
     * @param pathJson JSON array of path segments; numeric segments index arrays
     */
    public static String jsonText(String json, String pathJson) throws JsonProcessingException {
        if (json == null || pathJson == null) {
            return null;
        }
        JsonNode node = MAPPER.readTree(json);
        for (String segment : MAPPER.readValue(pathJson, PATH_TYPE)) {
            if (node == null) {
                return null;
            }
            if (node.isArray()) {
                node = isIndex(segment) ? node.get(Integer.parseInt(segment)) : null;
            } else if (node.isObject()) {
                node = node.get(segment);
            } else {
                return null;
            }
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isContainerNode() ? MAPPER.writeValueAsString(node) : node.asText();
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
