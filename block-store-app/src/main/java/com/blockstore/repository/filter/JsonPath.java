package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A dotted accessor resolved to its column and the segments inside it.
 * {@code content.data.category} targets {@code content} at {@code [data, category]};
 * a path without a known root prefix is read from {@code properties}.
 */
public record JsonPath(JsonColumn column, List<String> segments) {

    public JsonPath {
        segments = List.copyOf(segments);
    }

    public static JsonPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new FilterValidationException("Property filter path cannot be empty.");
        }
        List<String> parts = new ArrayList<>(Arrays.stream(path.trim().split("\\."))
            .filter(part -> !part.isEmpty())
            .toList());
        if (parts.isEmpty()) {
            throw new FilterValidationException("Property filter path '" + path + "' has no segments.");
        }
        JsonColumn column = JsonColumn.forPrefix(parts.get(0)).orElse(null);
        if (column == null) {
            return new JsonPath(JsonColumn.PROPERTIES, parts);
        }
        parts.remove(0);
        if (parts.isEmpty()) {
            throw new FilterValidationException("Property filter path '" + path + "' must address a field inside " + column.columnName() + ".");
        }
        return new JsonPath(column, parts);
    }
}
