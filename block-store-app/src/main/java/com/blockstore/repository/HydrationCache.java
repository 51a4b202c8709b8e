package com.blockstore.repository;

import com.blockstore.model.Block;
import com.blockstore.model.BlockResolver;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Blocks loaded by one {@code get} call, keyed by id. Every block handed out
 * navigates through this cache, so asking for the same id twice yields the
 * same instance. Ids outside the loaded set go to the fallback resolver and
 * are kept too.
 */
class HydrationCache implements BlockResolver {

    private final Map<UUID, Block> loaded = new HashMap<>();
    private final Map<UUID, Block> wired = new HashMap<>();
    private final BlockResolver fallback;

    HydrationCache(BlockResolver fallback) {
        this.fallback = fallback;
    }

    void put(Block block) {
        loaded.putIfAbsent(block.id(), block);
    }

    boolean contains(UUID id) {
        return loaded.containsKey(id);
    }

    int size() {
        return loaded.size();
    }

    @Override
    public Optional<Block> resolve(UUID id) {
        Block block = wired.get(id);
        if (block != null) {
            return Optional.of(block);
        }
        Block raw = loaded.get(id);
        if (raw != null) {
            block = raw.withResolver(this);
        } else {
            block = fallback.resolve(id).orElse(null);
            if (block == null) {
                return Optional.empty();
            }
        }
        wired.put(id, block);
        return Optional.of(block);
    }
}
