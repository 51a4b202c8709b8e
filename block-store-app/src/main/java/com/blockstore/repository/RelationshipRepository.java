package com.blockstore.repository;

import com.blockstore.db.BlockJsonCodec;
import com.blockstore.db.SqlDialect;
import com.blockstore.model.Relationship;
import com.blockstore.model.RelationshipDirection;
import com.blockstore.model.RelationshipKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static com.blockstore.repository.BlockRepository.instant;
import static com.blockstore.repository.BlockRepository.str;
import static com.blockstore.repository.BlockRepository.timestamp;
import static com.blockstore.repository.BlockRepository.uuid;

/**
 * Typed edges between blocks, unique per (source, target, rel_type).
 * Rows go away with either endpoint (foreign keys cascade).
 */
@Repository
public class RelationshipRepository {

    private static final Logger log = LoggerFactory.getLogger(RelationshipRepository.class);

    private final JdbcTemplate jdbc;
    private final SqlDialect dialect;
    private final BlockJsonCodec json;
    private final RowMapper<Relationship> relationshipMapper;

    public RelationshipRepository(JdbcTemplate jdbc, SqlDialect dialect, BlockJsonCodec json) {
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.json = json;
        this.relationshipMapper = (rs, rowNum) -> new Relationship(
            uuid(rs, "id"),
            uuid(rs, "workspace_id"),
            uuid(rs, "source_block_id"),
            uuid(rs, "target_block_id"),
            rs.getString("rel_type"),
            json.readMap(rs.getString("metadata")),
            rs.getInt("version"),
            instant(rs, "created_time"),
            instant(rs, "last_edited_time"),
            uuid(rs, "created_by"),
            uuid(rs, "last_edited_by")
        );
    }

    /**
     * Insert each relationship; an existing one with the same key keeps its id
     * and creation stamps, takes the new metadata and edit stamps, and moves to
     * the next version.
     */
    @Transactional
    public void upsert(Collection<Relationship> relationships) {
        if (relationships.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(relationships.size());
        for (Relationship relationship : relationships) {
            rows.add(new Object[] {
                relationship.id().toString(),
                str(relationship.workspaceId()),
                relationship.sourceBlockId().toString(),
                relationship.targetBlockId().toString(),
                relationship.relType(),
                json.writeMap(relationship.metadata()),
                relationship.version(),
                timestamp(relationship.createdTime()),
                timestamp(relationship.lastEditedTime()),
                str(relationship.createdBy()),
                str(relationship.lastEditedBy())
            });
        }
        jdbc.batchUpdate(dialect.upsertRelationshipSql(), rows);
        log.debug("Upserted {} relationships", rows.size());
    }

    /**
     * @return true if at least one relationship was removed
     */
    @Transactional
    public boolean delete(Collection<RelationshipKey> keys) {
        int deleted = 0;
        for (RelationshipKey key : keys) {
            deleted += jdbc.update(
                "DELETE FROM relationships WHERE source_block_id = ? AND target_block_id = ? AND rel_type = ?",
                key.sourceBlockId().toString(), key.targetBlockId().toString(), key.relType());
        }
        log.debug("Deleted {} of {} relationships", deleted, keys.size());
        return deleted > 0;
    }

    @Transactional(readOnly = true)
    public List<Relationship> get(UUID blockId) {
        return get(blockId, RelationshipDirection.ALL, false);
    }

    /**
     * Relationships touching {@code blockId}. Unless {@code includeTrashed},
     * rows whose source or target is in the trash are hidden.
     */
    @Transactional(readOnly = true)
    public List<Relationship> get(UUID blockId, RelationshipDirection direction, boolean includeTrashed) {
        StringBuilder sql = new StringBuilder("""
            SELECT r.* FROM relationships r
            JOIN blocks s ON s.id = r.source_block_id
            JOIN blocks t ON t.id = r.target_block_id
            WHERE 1=1
            """);
        List<Object> params = new ArrayList<>();

        switch (direction) {
            case OUTGOING -> sql.append(" AND r.source_block_id = ?");
            case INCOMING -> sql.append(" AND r.target_block_id = ?");
            case ALL -> {
                sql.append(" AND (r.source_block_id = ? OR r.target_block_id = ?)");
                params.add(blockId.toString());
            }
        }
        params.add(blockId.toString());

        if (!includeTrashed) {
            sql.append(" AND s.in_trash = FALSE AND t.in_trash = FALSE");
        }
        sql.append(" ORDER BY r.created_time");

        return jdbc.query(sql.toString(), relationshipMapper, params.toArray());
    }
}
