package com.blockstore.repository.filter;

import java.util.Optional;

/** The JSON columns a property path can address, keyed by the path's first segment. */
public enum JsonColumn {
    PROPERTIES("properties"),
    CONTENT("content"),
    METADATA("metadata");

    private final String columnName;

    JsonColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }

    static Optional<JsonColumn> forPrefix(String segment) {
        for (JsonColumn column : values()) {
            if (column.columnName.equals(segment)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
