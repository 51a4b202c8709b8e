package com.blockstore.model.properties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Type-specific structured payload of a block. The underlying map is open:
 * keys a subclass does not know about are kept and round-tripped untouched.
 * Subclasses add typed accessors and validate their own keys on construction.
 */
public class BlockProperties {

    private final Map<String, Object> values;

    public BlockProperties(Map<String, Object> values) {
        this.values = values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static BlockProperties empty() {
        return new BlockProperties(Map.of());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    protected String stringValue(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("Property '" + key + "' must be a string, got " + value.getClass().getSimpleName());
        }
        return s;
    }

    protected String requiredString(String key) {
        String value = stringValue(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Property '" + key + "' is required for " + getClass().getSimpleName());
        }
        return value;
    }

    protected Integer intValue(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n && !(value instanceof Double) && !(value instanceof Float)) {
            return n.intValue();
        }
        throw new IllegalArgumentException("Property '" + key + "' must be an integer, got " + value);
    }

    protected List<UUID> uuidList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> raw)) {
            throw new IllegalArgumentException("Property '" + key + "' must be a list of ids");
        }
        List<UUID> ids = new ArrayList<>(raw.size());
        for (Object item : raw) {
            ids.add(item instanceof UUID uuid ? uuid : UUID.fromString(String.valueOf(item)));
        }
        return List.copyOf(ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((BlockProperties) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + values;
    }
}
