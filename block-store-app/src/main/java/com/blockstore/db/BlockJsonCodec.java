package com.blockstore.db;

import com.blockstore.exception.RepositoryException;
import com.blockstore.model.Content;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts the JSON columns of {@code blocks} and {@code relationships}
 * to and from their Java values.
 */
@Component
public class BlockJsonCodec {

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public BlockJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeIds(List<UUID> ids) {
        return write(ids.stream().map(UUID::toString).toList());
    }

    public List<UUID> readIds(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<UUID> ids = new ArrayList<>();
        for (String id : read(json, ID_LIST)) {
            ids.add(UUID.fromString(id));
        }
        return ids;
    }

    public String writeMap(Map<String, Object> values) {
        return write(values == null ? Map.of() : values);
    }

    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return read(json, OBJECT_MAP);
    }

    public String writeContent(Content content) {
        return content == null ? null : write(content);
    }

    public Content readContent(String json) {
        if (json == null || json.isBlank() || "null".equals(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Content.class);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Cannot decode block content: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Cannot encode " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RepositoryException("Cannot decode JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
