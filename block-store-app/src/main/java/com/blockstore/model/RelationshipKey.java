package com.blockstore.model;

import java.util.Objects;
import java.util.UUID;

/** Natural key of a relationship: (source, target, type). */
public record RelationshipKey(UUID sourceBlockId, UUID targetBlockId, String relType) {
    public RelationshipKey {
        Objects.requireNonNull(sourceBlockId, "sourceBlockId");
        Objects.requireNonNull(targetBlockId, "targetBlockId");
        Objects.requireNonNull(relType, "relType");
    }
}
