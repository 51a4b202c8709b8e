package com.blockstore.repository;

import com.blockstore.db.BlockJsonCodec;
import com.blockstore.db.SqlDialect;
import com.blockstore.exception.BlockNotFoundException;
import com.blockstore.exception.InvalidChildrenException;
import com.blockstore.exception.VersionConflictException;
import com.blockstore.model.Block;
import com.blockstore.model.BlockResolver;
import com.blockstore.model.BlockType;
import com.blockstore.model.Depth;
import com.blockstore.model.properties.PropertiesRegistry;
import com.blockstore.repository.filter.FilterCompiler;
import com.blockstore.repository.filter.SqlFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence of the block tree. Reads hydrate {@link Block} values with
 * resolver-backed navigation; structural writes validate first, then apply
 * conditional updates guarded by each row's version.
 */
@Repository
public class BlockRepository {

    private static final Logger log = LoggerFactory.getLogger(BlockRepository.class);

    // Root blocks that may hold other trees' roots as children
    private static final Set<BlockType> CONTAINER_TYPES = EnumSet.of(BlockType.WORKSPACE, BlockType.COLLECTION);

    private final JdbcTemplate jdbc;
    private final SqlDialect dialect;
    private final FilterCompiler filterCompiler;
    private final BlockJsonCodec json;
    private final RowMapper<Block> blockMapper;

    public BlockRepository(JdbcTemplate jdbc, SqlDialect dialect, FilterCompiler filterCompiler, BlockJsonCodec json) {
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.filterCompiler = filterCompiler;
        this.json = json;
        this.blockMapper = (rs, rowNum) -> mapBlock(rs);
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public Optional<Block> get(UUID id, Depth depth) {
        return get(id, depth, false);
    }

    /**
     * Fetch a block and hydrate its descendants.
     *
     * <p>{@code Depth.none()} returns the node alone; navigation then issues one
     * query per hop. {@code Depth.of(n)} loads n levels of children up front, one
     * query per level. {@code Depth.unbounded()} loads every block sharing the
     * node's root in a single query. Within a hydrated set, navigating to the
     * same id twice returns the same instance.
     *
     * @return empty when the block is missing or trashed and {@code includeTrashed} is false
     */
    @Transactional(readOnly = true)
    public Optional<Block> get(UUID id, Depth depth, boolean includeTrashed) {
        Optional<Block> found = fetchOne(id, includeTrashed);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        BlockResolver lazy = lazyResolver(includeTrashed);
        if (depth.isNone()) {
            return Optional.of(found.get().withResolver(lazy));
        }

        HydrationCache cache = new HydrationCache(lazy);
        Block block = found.get();
        cache.put(block);
        if (depth.isUnbounded()) {
            String sql = "SELECT b.* FROM blocks b WHERE b.root_id = ?"
                + (includeTrashed ? "" : " AND b.in_trash = FALSE");
            jdbc.query(sql, blockMapper, block.rootId().toString()).forEach(cache::put);
        } else {
            List<Block> frontier = List.of(block);
            for (int level = 0; level < depth.levels() && !frontier.isEmpty(); level++) {
                List<UUID> childIds = new ArrayList<>();
                for (Block parent : frontier) {
                    for (UUID childId : parent.childrenIds()) {
                        if (!cache.contains(childId)) {
                            childIds.add(childId);
                        }
                    }
                }
                frontier = fetchAll(childIds, includeTrashed);
                frontier.forEach(cache::put);
            }
        }
        log.debug("Hydrated {} blocks for {} at depth {}", cache.size(), id,
            depth.isUnbounded() ? "unbounded" : depth.levels());
        return cache.resolve(id);
    }

    @Transactional(readOnly = true)
    public List<Block> query(BlockQuery query) {
        StringBuilder sql = new StringBuilder("SELECT b.* FROM blocks b");
        if (query.parentFilter() != null) {
            sql.append(" JOIN blocks p ON p.id = b.parent_id");
        }
        if (query.rootFilter() != null) {
            sql.append(" JOIN blocks r ON r.id = b.root_id");
        }
        sql.append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (!query.includeTrashed()) {
            sql.append(" AND b.in_trash = FALSE");
        }
        SqlFragment condition = filterCompiler.where("b", query.where())
            .and(filterCompiler.expression("b", query.propertyFilter()))
            .and(filterCompiler.related("p", query.parentFilter()))
            .and(filterCompiler.related("r", query.rootFilter()));
        if (!condition.isAlwaysTrue()) {
            sql.append(" AND ").append(condition.sql());
            params.addAll(condition.params());
        }
        if (query.limit() != null) {
            sql.append(" LIMIT ?");
            params.add(query.limit());
        }

        BlockResolver lazy = lazyResolver(query.includeTrashed());
        return jdbc.query(sql.toString(), blockMapper, params.toArray()).stream()
            .map(block -> block.withResolver(lazy))
            .toList();
    }

    // ==================== Writes ====================

    /**
     * Insert or replace each block by id. Last write wins: no version check and
     * no change to any other block's children.
     */
    @Transactional
    public void upsert(Collection<Block> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            rows.add(blockRow(block));
        }
        jdbc.batchUpdate(dialect.upsertBlockSql(), rows);
        log.debug("Upserted {} blocks", rows.size());
    }

    /**
     * Replace the children of {@code parentId} with {@code newChildrenIds}, in
     * that order. Listed children are pointed at the parent; dropped children
     * that still point at it are orphaned. Only the parent's version moves.
     *
     * @throws InvalidChildrenException duplicates, the parent itself, one of its ancestors,
     *                                  or a child from another tree, unless the child is a root
     *                                  and the parent a workspace or collection root
     * @throws BlockNotFoundException   the parent or a child is missing
     * @throws VersionConflictException the parent is not at {@code expectedVersion}
     */
    @Transactional
    public void setChildren(UUID parentId, List<UUID> newChildrenIds, int expectedVersion) {
        List<UUID> children = List.copyOf(newChildrenIds);
        Set<UUID> distinct = new HashSet<>(children);
        if (distinct.size() != children.size()) {
            throw new InvalidChildrenException("Duplicate children ids for parent " + parentId + ": " + children);
        }

        Block parent = require("Parent", parentId);
        checkVersion(parent, expectedVersion);
        if (distinct.contains(parentId)) {
            throw new InvalidChildrenException("Block " + parentId + " cannot be its own child.");
        }

        Map<UUID, Block> found = fetchByIds(children, true);
        List<UUID> missing = children.stream().filter(childId -> !found.containsKey(childId)).toList();
        if (!missing.isEmpty()) {
            throw new BlockNotFoundException("Child blocks " + missing + " do not exist.", missing);
        }
        for (Block child : found.values()) {
            if (!sharesTree(parent, child)) {
                throw new InvalidChildrenException("Child " + child.id() + " belongs to root " + child.rootId()
                    + ", parent " + parentId + " to root " + parent.rootId() + ".");
            }
        }
        Set<UUID> ancestors = ancestorIds(parentId);
        for (UUID childId : children) {
            if (ancestors.contains(childId)) {
                throw new InvalidChildrenException("Block " + childId + " is an ancestor of " + parentId
                    + "; adding it as a child would create a cycle.");
            }
        }

        Instant now = now();
        writeChildren(parent, children, expectedVersion, now);
        if (!children.isEmpty()) {
            List<Object> params = new ArrayList<>();
            params.add(parentId.toString());
            params.addAll(ids(children));
            jdbc.update("UPDATE blocks SET parent_id = ? WHERE id IN (" + placeholders(children.size()) + ")",
                params.toArray());
        }
        List<UUID> dropped = parent.childrenIds().stream().filter(childId -> !distinct.contains(childId)).toList();
        if (!dropped.isEmpty()) {
            List<Object> params = new ArrayList<>(ids(dropped));
            params.add(parentId.toString());
            jdbc.update("UPDATE blocks SET parent_id = NULL WHERE id IN (" + placeholders(dropped.size())
                + ") AND parent_id = ?", params.toArray());
        }
        log.debug("Set {} children on {} (v{} -> v{}), orphaned {}", children.size(), parentId,
            expectedVersion, expectedVersion + 1, dropped.size());
    }

    /**
     * Reorder the existing children of {@code parentId}. {@code newOrder} must be
     * a permutation of the current children.
     */
    @Transactional
    public void reorderChildren(UUID parentId, List<UUID> newOrder, int expectedVersion) {
        Block parent = require("Parent", parentId);
        Set<UUID> current = new HashSet<>(parent.childrenIds());
        Set<UUID> proposed = new HashSet<>(newOrder);
        if (newOrder.size() != parent.childrenIds().size() || proposed.size() != newOrder.size()
            || !proposed.equals(current)) {
            throw new InvalidChildrenException("New order " + newOrder + " is not a permutation of the children of "
                + parentId + ": " + parent.childrenIds());
        }
        setChildren(parentId, newOrder, expectedVersion);
    }

    /**
     * Move a block under {@code newParentId} at {@code index} (clamped to the
     * children's bounds). Both parents and the block get a new version.
     *
     * @param expectedOldParentVersion checked against the current parent when given; may be null
     * @throws InvalidChildrenException the move crosses trees or would create a cycle
     * @throws BlockNotFoundException   the block, the new parent, or the recorded old parent is missing
     */
    @Transactional
    public void moveBlock(UUID blockId, UUID newParentId, int index, int expectedBlockVersion,
                          int expectedNewParentVersion, Integer expectedOldParentVersion) {
        Block block = require("Block", blockId);
        checkVersion(block, expectedBlockVersion);
        Block newParent = require("Parent", newParentId);
        checkVersion(newParent, expectedNewParentVersion);

        if (newParentId.equals(blockId)) {
            throw new InvalidChildrenException("Block " + blockId + " cannot be moved under itself.");
        }
        if (!sharesTree(newParent, block)) {
            throw new InvalidChildrenException("Cannot move " + blockId + " from root " + block.rootId()
                + " to parent " + newParentId + " under root " + newParent.rootId() + ".");
        }
        if (ancestorIds(newParentId).contains(blockId)) {
            throw new InvalidChildrenException("Block " + newParentId + " is a descendant of " + blockId
                + "; the move would create a cycle.");
        }

        Instant now = now();
        if (!newParentId.equals(block.parentId()) && block.parentId() != null) {
            Block old = fetchOne(block.parentId(), true)
                .orElseThrow(() -> new BlockNotFoundException("Old parent", block.parentId()));
            if (expectedOldParentVersion != null) {
                checkVersion(old, expectedOldParentVersion);
            }
            List<UUID> remaining = new ArrayList<>(old.childrenIds());
            remaining.remove(blockId);
            writeChildren(old, remaining, old.version(), now);
        }

        List<UUID> order = new ArrayList<>(newParent.childrenIds());
        order.remove(blockId);
        int position = Math.max(0, Math.min(index, order.size()));
        order.add(position, blockId);
        writeChildren(newParent, order, expectedNewParentVersion, now);

        int updated = jdbc.update(
            "UPDATE blocks SET parent_id = ?, version = version + 1, last_edited_time = ? WHERE id = ? AND version = ?",
            newParentId.toString(), timestamp(now), blockId.toString(), expectedBlockVersion);
        if (updated == 0) {
            throw new VersionConflictException(blockId, expectedBlockVersion, currentVersion(blockId));
        }
        log.debug("Moved {} under {} at position {}", blockId, newParentId, position);
    }

    /**
     * Set the trash flag on {@code ids} and, with {@code cascade}, on every
     * descendant reachable through children lists. Each affected row gets a
     * new version. Restoring clears the flag on the whole closure.
     *
     * @throws BlockNotFoundException listing every requested id that does not exist
     */
    @Transactional
    public void setInTrash(Collection<UUID> ids, boolean inTrash, boolean cascade) {
        Set<UUID> requested = new LinkedHashSet<>(ids);
        if (requested.isEmpty()) {
            return;
        }
        Map<UUID, Block> found = fetchByIds(requested, true);
        List<UUID> missing = requested.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new BlockNotFoundException("Blocks " + missing + " do not exist.", missing);
        }

        Set<UUID> closure = new LinkedHashSet<>(requested);
        if (cascade) {
            List<UUID> frontier = new ArrayList<>(requested);
            while (!frontier.isEmpty()) {
                List<UUID> next = new ArrayList<>();
                for (List<UUID> childIds : childrenIdsOf(frontier).values()) {
                    for (UUID childId : childIds) {
                        if (closure.add(childId)) {
                            next.add(childId);
                        }
                    }
                }
                frontier = next;
            }
        }

        List<Object> params = new ArrayList<>();
        params.add(inTrash);
        params.add(timestamp(now()));
        params.addAll(ids(closure));
        int updated = jdbc.update("UPDATE blocks SET in_trash = ?, version = version + 1, last_edited_time = ? "
            + "WHERE id IN (" + placeholders(closure.size()) + ")", params.toArray());
        log.debug("{} {} blocks ({} requested)", inTrash ? "Trashed" : "Restored", updated, requested.size());
    }

    // ==================== Structural helpers ====================

    /**
     * Ids from {@code startId} up to its root, start included. A repeated id
     * means the stored tree already has a cycle; the walk stops there.
     */
    Set<UUID> ancestorIds(UUID startId) {
        Set<UUID> visited = new LinkedHashSet<>();
        UUID current = startId;
        while (current != null) {
            if (!visited.add(current)) {
                log.warn("Parent cycle through block {} found while walking ancestors of {}", current, startId);
                break;
            }
            List<String> parents = jdbc.queryForList("SELECT parent_id FROM blocks WHERE id = ?",
                String.class, current.toString());
            if (parents.isEmpty() || parents.get(0) == null) {
                break;
            }
            current = UUID.fromString(parents.get(0));
        }
        return visited;
    }

    /**
     * A child belongs under a parent of its own tree. The one exception is a
     * root block (a document or dataset) hung under a workspace or collection
     * that is itself a root.
     */
    private static boolean sharesTree(Block parent, Block child) {
        if (child.rootId().equals(parent.rootId())) {
            return true;
        }
        boolean childIsRoot = child.rootId().equals(child.id());
        boolean parentIsContainerRoot = parent.rootId().equals(parent.id()) && CONTAINER_TYPES.contains(parent.type());
        return childIsRoot && parentIsContainerRoot;
    }

    private void writeChildren(Block parent, List<UUID> children, int expectedVersion, Instant now) {
        int updated = jdbc.update(
            "UPDATE blocks SET children_ids = " + dialect.jsonParameter()
                + ", version = version + 1, last_edited_time = ? WHERE id = ? AND version = ?",
            json.writeIds(children), timestamp(now), parent.id().toString(), expectedVersion);
        if (updated == 0) {
            throw new VersionConflictException(parent.id(), expectedVersion, currentVersion(parent.id()));
        }
    }

    private void checkVersion(Block block, int expectedVersion) {
        if (block.version() != expectedVersion) {
            throw new VersionConflictException(block.id(), expectedVersion, block.version());
        }
    }

    private Block require(String role, UUID id) {
        return fetchOne(id, true).orElseThrow(() -> new BlockNotFoundException(role, id));
    }

    private Integer currentVersion(UUID id) {
        List<Integer> versions = jdbc.queryForList("SELECT version FROM blocks WHERE id = ?", Integer.class, id.toString());
        return versions.isEmpty() ? null : versions.get(0);
    }

    // ==================== Row access ====================

    private Optional<Block> fetchOne(UUID id, boolean includeTrashed) {
        String sql = "SELECT b.* FROM blocks b WHERE b.id = ?" + (includeTrashed ? "" : " AND b.in_trash = FALSE");
        return jdbc.query(sql, blockMapper, id.toString()).stream().findFirst();
    }

    private List<Block> fetchAll(Collection<UUID> ids, boolean includeTrashed) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT b.* FROM blocks b WHERE b.id IN (" + placeholders(ids.size()) + ")"
            + (includeTrashed ? "" : " AND b.in_trash = FALSE");
        return jdbc.query(sql, blockMapper, ids(ids).toArray());
    }

    private Map<UUID, Block> fetchByIds(Collection<UUID> ids, boolean includeTrashed) {
        Map<UUID, Block> byId = new LinkedHashMap<>();
        for (Block block : fetchAll(ids, includeTrashed)) {
            byId.put(block.id(), block);
        }
        return byId;
    }

    private Map<UUID, List<UUID>> childrenIdsOf(Collection<UUID> ids) {
        Map<UUID, List<UUID>> children = new LinkedHashMap<>();
        jdbc.query("SELECT id, children_ids FROM blocks WHERE id IN (" + placeholders(ids.size()) + ")",
            rs -> {
                children.put(UUID.fromString(rs.getString("id")), json.readIds(rs.getString("children_ids")));
            },
            ids(ids).toArray());
        return children;
    }

    private BlockResolver lazyResolver(boolean includeTrashed) {
        return id -> get(id, Depth.none(), includeTrashed);
    }

    private Block mapBlock(ResultSet rs) throws SQLException {
        BlockType type = BlockType.fromValue(rs.getString("type"));
        return Block.builder(type)
            .id(uuid(rs, "id"))
            .parentId(uuid(rs, "parent_id"))
            .rootId(uuid(rs, "root_id"))
            .childrenIds(json.readIds(rs.getString("children_ids")))
            .workspaceId(uuid(rs, "workspace_id"))
            .inTrash(rs.getBoolean("in_trash"))
            .version(rs.getInt("version"))
            .createdTime(instant(rs, "created_time"))
            .lastEditedTime(instant(rs, "last_edited_time"))
            .createdBy(uuid(rs, "created_by"))
            .lastEditedBy(uuid(rs, "last_edited_by"))
            .properties(PropertiesRegistry.create(type, json.readMap(rs.getString("properties"))))
            .metadata(json.readMap(rs.getString("metadata")))
            .content(json.readContent(rs.getString("content")))
            .propertiesVersion(rs.getObject("properties_version") != null ? rs.getInt("properties_version") : null)
            .build();
    }

    private Object[] blockRow(Block block) {
        return new Object[] {
            block.id().toString(),
            block.type().value(),
            str(block.parentId()),
            block.rootId().toString(),
            json.writeIds(block.childrenIds()),
            str(block.workspaceId()),
            block.inTrash(),
            block.version(),
            timestamp(block.createdTime()),
            timestamp(block.lastEditedTime()),
            str(block.createdBy()),
            str(block.lastEditedBy()),
            json.writeMap(block.properties().asMap()),
            json.writeMap(block.metadata()),
            json.writeContent(block.content()),
            block.propertiesVersion()
        };
    }

    static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static OffsetDateTime timestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    static String str(UUID id) {
        return id != null ? id.toString() : null;
    }

    static List<String> ids(Collection<UUID> ids) {
        return ids.stream().map(UUID::toString).toList();
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
