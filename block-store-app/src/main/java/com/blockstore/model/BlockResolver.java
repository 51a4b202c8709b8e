package com.blockstore.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Navigation capability injected into {@link Block} values. A block does not
 * own its parent or children; it asks the resolver it was loaded with.
 */
public interface BlockResolver {

    BlockResolver NONE = id -> Optional.empty();

    Optional<Block> resolve(UUID id);

    default List<Block> resolveAll(List<UUID> ids) {
        List<Block> resolved = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            resolve(id).ifPresent(resolved::add);
        }
        return resolved;
    }
}
