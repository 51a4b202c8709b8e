package com.blockstore.db;

import com.blockstore.repository.filter.ValueKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * H2 (PostgreSQL mode): JSON stored as text, paths read through the
 * {@code block_json_text} alias over {@link H2JsonFunctions}, upserts via
 * {@code MERGE ... USING}.
 */
public class H2Dialect implements SqlDialect {

    private static final String UPSERT_BLOCK = """
        MERGE INTO blocks t
        USING (SELECT CAST(? AS VARCHAR(36)) AS id, CAST(? AS VARCHAR(32)) AS type,
                      CAST(? AS VARCHAR(36)) AS parent_id, CAST(? AS VARCHAR(36)) AS root_id,
                      CAST(? AS VARCHAR) AS children_ids, CAST(? AS VARCHAR(36)) AS workspace_id,
                      CAST(? AS BOOLEAN) AS in_trash, CAST(? AS INTEGER) AS version,
                      CAST(? AS TIMESTAMP WITH TIME ZONE) AS created_time,
                      CAST(? AS TIMESTAMP WITH TIME ZONE) AS last_edited_time,
                      CAST(? AS VARCHAR(36)) AS created_by, CAST(? AS VARCHAR(36)) AS last_edited_by,
                      CAST(? AS VARCHAR) AS properties, CAST(? AS VARCHAR) AS metadata,
                      CAST(? AS VARCHAR) AS content, CAST(? AS INTEGER) AS properties_version) s
        ON t.id = s.id
        WHEN MATCHED THEN UPDATE SET
            type = s.type, parent_id = s.parent_id, root_id = s.root_id, children_ids = s.children_ids,
            workspace_id = s.workspace_id, in_trash = s.in_trash, version = s.version,
            created_time = s.created_time, last_edited_time = s.last_edited_time,
            created_by = s.created_by, last_edited_by = s.last_edited_by,
            properties = s.properties, metadata = s.metadata, content = s.content,
            properties_version = s.properties_version
        WHEN NOT MATCHED THEN INSERT (id, type, parent_id, root_id, children_ids, workspace_id, in_trash, version,
                                      created_time, last_edited_time, created_by, last_edited_by,
                                      properties, metadata, content, properties_version)
            VALUES (s.id, s.type, s.parent_id, s.root_id, s.children_ids, s.workspace_id, s.in_trash, s.version,
                    s.created_time, s.last_edited_time, s.created_by, s.last_edited_by,
                    s.properties, s.metadata, s.content, s.properties_version)
        """;

    private static final String UPSERT_RELATIONSHIP = """
        MERGE INTO relationships t
        USING (SELECT CAST(? AS VARCHAR(36)) AS id, CAST(? AS VARCHAR(36)) AS workspace_id,
                      CAST(? AS VARCHAR(36)) AS source_block_id, CAST(? AS VARCHAR(36)) AS target_block_id,
                      CAST(? AS VARCHAR(64)) AS rel_type, CAST(? AS VARCHAR) AS metadata,
                      CAST(? AS INTEGER) AS version,
                      CAST(? AS TIMESTAMP WITH TIME ZONE) AS created_time,
                      CAST(? AS TIMESTAMP WITH TIME ZONE) AS last_edited_time,
                      CAST(? AS VARCHAR(36)) AS created_by, CAST(? AS VARCHAR(36)) AS last_edited_by) s
        ON t.source_block_id = s.source_block_id AND t.target_block_id = s.target_block_id AND t.rel_type = s.rel_type
        WHEN MATCHED THEN UPDATE SET
            metadata = s.metadata, last_edited_time = s.last_edited_time,
            last_edited_by = s.last_edited_by, version = t.version + 1
        WHEN NOT MATCHED THEN INSERT (id, workspace_id, source_block_id, target_block_id, rel_type, metadata, version,
                                      created_time, last_edited_time, created_by, last_edited_by)
            VALUES (s.id, s.workspace_id, s.source_block_id, s.target_block_id, s.rel_type, s.metadata, s.version,
                    s.created_time, s.last_edited_time, s.created_by, s.last_edited_by)
        """;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public String jsonParameter() {
        return "?";
    }

    @Override
    public String jsonText(String column) {
        return "block_json_text(" + column + ", ?)";
    }

    /** JSON array of the segments, decoded again by {@link H2JsonFunctions#jsonText}. */
    @Override
    public Object jsonPath(List<String> segments) {
        try {
            return MAPPER.writeValueAsString(segments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode JSON path " + segments, e);
        }
    }

    @Override
    public String sqlType(ValueKind kind) {
        return switch (kind) {
            case BOOLEAN -> "BOOLEAN";
            case INTEGER -> "BIGINT";
            case FLOAT -> "DOUBLE PRECISION";
            case STRING -> "VARCHAR";
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
