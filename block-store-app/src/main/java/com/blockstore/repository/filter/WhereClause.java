package com.blockstore.repository.filter;

import com.blockstore.model.BlockType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Conjunction of membership constraints on indexed block columns. Empty sets
 * are ignored; a single value compiles to equality, several to {@code IN}.
 */
public record WhereClause(
    Set<BlockType> types,
    Set<UUID> parentIds,
    Set<UUID> rootIds,
    Set<UUID> workspaceIds
) {
    private static final WhereClause EMPTY = new WhereClause(null, null, null, null);

    public WhereClause {
        types = copy(types);
        parentIds = copy(parentIds);
        rootIds = copy(rootIds);
        workspaceIds = copy(workspaceIds);
    }

    public static WhereClause empty() {
        return EMPTY;
    }

    public static WhereClause ofTypes(BlockType... types) {
        return builder().types(types).build();
    }

    public static WhereClause ofRoot(UUID rootId) {
        return builder().rootIds(rootId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return types.isEmpty() && parentIds.isEmpty() && rootIds.isEmpty() && workspaceIds.isEmpty();
    }

    private static <T> Set<T> copy(Collection<T> values) {
        return values == null || values.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static final class Builder {
        private final Set<BlockType> types = new LinkedHashSet<>();
        private final Set<UUID> parentIds = new LinkedHashSet<>();
        private final Set<UUID> rootIds = new LinkedHashSet<>();
        private final Set<UUID> workspaceIds = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder types(BlockType... values) {
            Collections.addAll(types, values);
            return this;
        }

        public Builder types(Collection<BlockType> values) {
            types.addAll(values);
            return this;
        }

        public Builder parentIds(UUID... values) {
            Collections.addAll(parentIds, values);
            return this;
        }

        public Builder rootIds(UUID... values) {
            Collections.addAll(rootIds, values);
            return this;
        }

        public Builder workspaceIds(UUID... values) {
            Collections.addAll(workspaceIds, values);
            return this;
        }

        public WhereClause build() {
            return new WhereClause(types, parentIds, rootIds, workspaceIds);
        }
    }
}
