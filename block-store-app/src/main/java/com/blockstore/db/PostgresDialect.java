package com.blockstore.db;

import com.blockstore.repository.filter.ValueKind;

import java.util.List;
import java.util.stream.Collectors;

/** PostgreSQL: JSONB columns, {@code #>>} path extraction, {@code ON CONFLICT} upserts. */
public class PostgresDialect implements SqlDialect {

    private static final String UPSERT_BLOCK = """
        INSERT INTO blocks (id, type, parent_id, root_id, children_ids, workspace_id, in_trash, version,
                            created_time, last_edited_time, created_by, last_edited_by,
                            properties, metadata, content, properties_version)
        VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?, ?, ?, ?, ?,
                CAST(? AS jsonb), CAST(? AS jsonb), CAST(? AS jsonb), ?)
        ON CONFLICT (id) DO UPDATE SET
            type = EXCLUDED.type,
            parent_id = EXCLUDED.parent_id,
            root_id = EXCLUDED.root_id,
            children_ids = EXCLUDED.children_ids,
            workspace_id = EXCLUDED.workspace_id,
            in_trash = EXCLUDED.in_trash,
            version = EXCLUDED.version,
            created_time = EXCLUDED.created_time,
            last_edited_time = EXCLUDED.last_edited_time,
            created_by = EXCLUDED.created_by,
            last_edited_by = EXCLUDED.last_edited_by,
            properties = EXCLUDED.properties,
            metadata = EXCLUDED.metadata,
            content = EXCLUDED.content,
            properties_version = EXCLUDED.properties_version
        """;

    private static final String UPSERT_RELATIONSHIP = """
        INSERT INTO relationships (id, workspace_id, source_block_id, target_block_id, rel_type, metadata, version,
                                   created_time, last_edited_time, created_by, last_edited_by)
        VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?, ?, ?)
        ON CONFLICT (source_block_id, target_block_id, rel_type) DO UPDATE SET
            metadata = EXCLUDED.metadata,
            last_edited_time = EXCLUDED.last_edited_time,
            last_edited_by = EXCLUDED.last_edited_by,
            version = relationships.version + 1
        """;

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String jsonParameter() {
        return "CAST(? AS jsonb)";
    }

    @Override
    public String jsonText(String column) {
        return "(" + column + " #>> CAST(? AS text[]))";
    }

    /** Array literal for the path, e.g. {@code {"data","category"}}. */
    @Override
    public Object jsonPath(List<String> segments) {
        return segments.stream()
            .map(segment -> "\"" + segment.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
            .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public String sqlType(ValueKind kind) {
        return switch (kind) {
            case BOOLEAN -> "BOOLEAN";
            case INTEGER -> "BIGINT";
            case FLOAT -> "DOUBLE PRECISION";
            case STRING -> "TEXT";
        };
    }

    @Override
    public String upsertBlockSql() {
        return UPSERT_BLOCK;
    }

    @Override
    public String upsertRelationshipSql() {
        return UPSERT_RELATIONSHIP;
    }
}
