package com.blockstore.db;

import com.blockstore.repository.filter.ValueKind;

import java.util.List;

/**
 * The SQL that differs between the production database and the embedded one
 * used by tests. Everything else the repositories issue is portable.
 */
public interface SqlDialect {

    String name();

    /** Placeholder binding a serialized JSON document into a JSON column. */
    String jsonParameter();

    /**
     * Expression yielding the text at a path inside a JSON column, or NULL when
     * the path is missing. It contains exactly one {@code ?}, bound to
     * {@link #jsonPath(List)}.
     */
    String jsonText(String column);

    Object jsonPath(List<String> segments);

    String sqlType(ValueKind kind);

    /**
     * Insert-or-replace of a block row keyed by {@code id}. Parameters follow
     * the column order of the {@code blocks} table.
     */
    String upsertBlockSql();

    /**
     * Insert of a relationship, or on a duplicate (source, target, rel_type)
     * an update of metadata and edit stamps with {@code version + 1}.
     * Parameters follow the column order of the {@code relationships} table.
     */
    String upsertRelationshipSql();
}
