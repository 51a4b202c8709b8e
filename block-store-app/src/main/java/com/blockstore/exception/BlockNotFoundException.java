package com.blockstore.exception;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/** A referenced block, parent or child does not exist. */
public class BlockNotFoundException extends RepositoryException {

    private final List<UUID> blockIds;

    public BlockNotFoundException(String message, Collection<UUID> blockIds) {
        super(message);
        this.blockIds = List.copyOf(blockIds);
    }

    public BlockNotFoundException(String role, UUID blockId) {
        this(role + " block " + blockId + " does not exist.", List.of(blockId));
    }

    public List<UUID> getBlockIds() {
        return blockIds;
    }
}
