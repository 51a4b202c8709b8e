package com.blockstore.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed, typed edge between two blocks, independent of the tree. At most
 * one relationship exists per {@link #key()}.
 */
public record Relationship(
    UUID id,
    UUID workspaceId,
    UUID sourceBlockId,
    UUID targetBlockId,
    String relType,
    Map<String, Object> metadata,
    int version,
    Instant createdTime,
    Instant lastEditedTime,
    UUID createdBy,
    UUID lastEditedBy
) {
    public Relationship {
        Objects.requireNonNull(sourceBlockId, "sourceBlockId");
        Objects.requireNonNull(targetBlockId, "targetBlockId");
        if (relType == null || relType.isBlank()) {
            throw new IllegalArgumentException("relType is required");
        }
        id = id != null ? id : UUID.randomUUID();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        createdTime = createdTime != null ? createdTime.truncatedTo(ChronoUnit.MICROS) : now;
        lastEditedTime = lastEditedTime != null ? lastEditedTime.truncatedTo(ChronoUnit.MICROS) : createdTime;
    }

    public static Relationship of(UUID workspaceId, UUID sourceBlockId, UUID targetBlockId, String relType) {
        return new Relationship(null, workspaceId, sourceBlockId, targetBlockId, relType,
            Map.of(), 0, null, null, null, null);
    }

    public Relationship withMetadata(Map<String, Object> metadata) {
        return new Relationship(id, workspaceId, sourceBlockId, targetBlockId, relType,
            metadata, version, createdTime, Instant.now(), createdBy, lastEditedBy);
    }

    public RelationshipKey key() {
        return new RelationshipKey(sourceBlockId, targetBlockId, relType);
    }
}
