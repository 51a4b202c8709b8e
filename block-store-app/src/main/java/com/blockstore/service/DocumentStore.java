package com.blockstore.service;

import com.blockstore.config.BlockStoreProperties;
import com.blockstore.exception.DocumentStoreException;
import com.blockstore.model.Block;
import com.blockstore.model.BlockType;
import com.blockstore.model.Depth;
import com.blockstore.model.Relationship;
import com.blockstore.model.RelationshipDirection;
import com.blockstore.model.RelationshipKey;
import com.blockstore.repository.BlockQuery;
import com.blockstore.repository.BlockRepository;
import com.blockstore.repository.RelationshipRepository;
import com.blockstore.repository.filter.WhereClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for callers working with whole documents. Adds document rules
 * on top of {@link BlockRepository}: which blocks may be opened as roots, how
 * freshly parsed blocks are attached to an existing tree, and default
 * versions for structural edits.
 *
 * <p>When a version argument is null it is read from the current row just
 * before the edit, so the edit is checked against whatever is stored at that
 * moment and can overwrite changes the caller never saw. Pass explicit
 * versions to get a strict compare-and-set.
 */
@Service
public class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final BlockRepository blockRepository;
    private final RelationshipRepository relationshipRepository;
    private final BlockStoreProperties properties;

    public DocumentStore(BlockRepository blockRepository,
                         RelationshipRepository relationshipRepository,
                         BlockStoreProperties properties) {
        this.blockRepository = blockRepository;
        this.relationshipRepository = relationshipRepository;
        this.properties = properties;
    }

    // ==================== Reads ====================

    public Block getRootTree(UUID rootId) {
        return getRootTree(rootId, Depth.of(1));
    }

    /**
     * The tree anchored at {@code rootId}.
     *
     * @throws DocumentStoreException if the block is missing or its type cannot anchor a tree
     */
    public Block getRootTree(UUID rootId, Depth depth) {
        Block root = requireBlock(rootId, depth);
        if (!properties.getRootTypes().contains(root.type())) {
            throw new DocumentStoreException("Block " + rootId + " is a " + root.type().value()
                + ", not a document root " + properties.getRootTypes() + ".");
        }
        return root;
    }

    public Optional<Block> getBlock(UUID blockId, Depth depth) {
        return blockRepository.get(blockId, depth);
    }

    public List<Block> query(BlockQuery query) {
        return blockRepository.query(query);
    }

    public List<Block> listDocuments(Integer limit) {
        return blockRepository.query(BlockQuery.builder()
            .where(WhereClause.ofTypes(BlockType.DOCUMENT))
            .limit(limit)
            .build());
    }

    /**
     * The canonical block a synced block mirrors, taken from
     * {@code content.synced_from} or else the {@code synced_from} property.
     */
    public Block resolveSynced(Block syncedBlock, Depth depth) {
        UUID targetId = syncedTargetId(syncedBlock);
        return blockRepository.get(targetId, depth).orElseThrow(() -> new DocumentStoreException(
            "Synced block " + syncedBlock.id() + " references missing block " + targetId + "."));
    }

    // ==================== Writes ====================

    public void saveBlocks(Collection<Block> blocks) {
        if (blocks.isEmpty()) {
            return;
        }
        blockRepository.upsert(blocks);
    }

    public void upsertBlocks(List<Block> blocks) {
        upsertBlocks(blocks, null, null, true);
    }

    /**
     * Persist {@code blocks} and, when {@code parentId} is given, attach them to
     * that parent. With {@code topLevelOnly} only blocks whose parent is not in
     * the batch are attached, so a parsed subtree keeps its own shape. Attached
     * blocks go right after {@code insertAfter} or at the end; ids already
     * under the parent are moved rather than listed twice.
     *
     * @throws DocumentStoreException if the parent is missing or {@code insertAfter} is not one of its children
     */
    public void upsertBlocks(List<Block> blocks, UUID parentId, UUID insertAfter, boolean topLevelOnly) {
        if (blocks.isEmpty()) {
            return;
        }
        blockRepository.upsert(blocks);
        if (parentId == null) {
            return;
        }

        Set<UUID> batchIds = new HashSet<>();
        blocks.forEach(block -> batchIds.add(block.id()));
        List<UUID> attached = new ArrayList<>();
        for (Block block : blocks) {
            boolean topLevel = block.parentId() == null || !batchIds.contains(block.parentId());
            if (!topLevelOnly || topLevel) {
                attached.add(block.id());
            }
        }
        if (attached.isEmpty()) {
            return;
        }

        Block parent = requireBlock(parentId, Depth.none());
        Set<UUID> moving = new LinkedHashSet<>(attached);
        List<UUID> children = new ArrayList<>();
        for (UUID childId : parent.childrenIds()) {
            if (!moving.contains(childId)) {
                children.add(childId);
            }
        }
        if (insertAfter != null) {
            int anchor = children.indexOf(insertAfter);
            if (anchor < 0) {
                throw new DocumentStoreException("Block " + insertAfter + " not found in parent " + parentId + ".");
            }
            children.addAll(anchor + 1, moving);
        } else {
            children.addAll(moving);
        }
        blockRepository.setChildren(parentId, children, parent.version());
        log.debug("Attached {} blocks under {}", moving.size(), parentId);
    }

    public void setChildren(UUID parentId, List<UUID> children, Integer expectedVersion) {
        int version = expectedVersion != null ? expectedVersion : currentVersion(parentId);
        blockRepository.setChildren(parentId, children, version);
    }

    public void reorderChildren(UUID parentId, List<UUID> order, Integer expectedVersion) {
        int version = expectedVersion != null ? expectedVersion : currentVersion(parentId);
        blockRepository.reorderChildren(parentId, order, version);
    }

    public void moveBlock(UUID blockId, UUID newParentId, int index) {
        moveBlock(blockId, newParentId, index, null, null, null);
    }

    public void moveBlock(UUID blockId, UUID newParentId, int index,
                          Integer blockVersion, Integer newParentVersion, Integer oldParentVersion) {
        Block block = requireBlock(blockId, Depth.none());
        int resolvedBlockVersion = blockVersion != null ? blockVersion : block.version();
        int resolvedNewParentVersion = newParentVersion != null ? newParentVersion : currentVersion(newParentId);
        Integer resolvedOldParentVersion = oldParentVersion;
        if (resolvedOldParentVersion == null && block.parentId() != null) {
            resolvedOldParentVersion = currentVersion(block.parentId());
        }
        blockRepository.moveBlock(blockId, newParentId, index,
            resolvedBlockVersion, resolvedNewParentVersion, resolvedOldParentVersion);
    }

    /** Trash or restore {@code ids} together with all their descendants. */
    public void setInTrash(Collection<UUID> ids, boolean inTrash) {
        blockRepository.setInTrash(ids, inTrash, true);
    }

    // ==================== Relationships ====================

    public void upsertRelationships(Collection<Relationship> relationships) {
        relationshipRepository.upsert(relationships);
    }

    public boolean deleteRelationships(Collection<RelationshipKey> keys) {
        return relationshipRepository.delete(keys);
    }

    public List<Relationship> getRelationships(UUID blockId, RelationshipDirection direction, boolean includeTrashed) {
        return relationshipRepository.get(blockId, direction, includeTrashed);
    }

    // ==================== Helpers ====================

    private Block requireBlock(UUID blockId, Depth depth) {
        return blockRepository.get(blockId, depth)
            .orElseThrow(() -> new DocumentStoreException("Block " + blockId + " does not exist."));
    }

    private int currentVersion(UUID blockId) {
        return requireBlock(blockId, Depth.none()).version();
    }

    private static UUID syncedTargetId(Block block) {
        if (block.content() != null && block.content().syncedFrom() != null) {
            return block.content().syncedFrom();
        }
        Object property = block.properties().get("synced_from");
        if (property != null) {
            try {
                return property instanceof UUID uuid ? uuid : UUID.fromString(property.toString());
            } catch (IllegalArgumentException e) {
                throw new DocumentStoreException("Synced block " + block.id() + " has a malformed synced_from "
                    + property + ".", e);
            }
        }
        throw new DocumentStoreException("Synced block " + block.id()
            + " does not provide a reference to canonical content.");
    }
}
