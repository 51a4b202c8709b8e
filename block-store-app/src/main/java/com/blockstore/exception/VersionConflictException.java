package com.blockstore.exception;

import java.util.UUID;

/** Optimistic concurrency check failed; re-read the block and resubmit. */
public class VersionConflictException extends RepositoryException {

    private final UUID blockId;
    private final int expectedVersion;
    private final Integer actualVersion;

    public VersionConflictException(UUID blockId, int expectedVersion, Integer actualVersion) {
        super("Block " + blockId + " version mismatch: expected " + expectedVersion
            + (actualVersion != null ? ", found " + actualVersion : ", row changed concurrently") + ".");
        this.blockId = blockId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public UUID getBlockId() {
        return blockId;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }

    public Integer getActualVersion() {
        return actualVersion;
    }
}
