package com.blockstore.repository;

import com.blockstore.repository.filter.FilterExpression;
import com.blockstore.repository.filter.ParentFilter;
import com.blockstore.repository.filter.RootFilter;
import com.blockstore.repository.filter.WhereClause;

/**
 * Arguments of {@link BlockRepository#query(BlockQuery)}. Every part is
 * optional; trashed blocks are left out unless {@code includeTrashed}.
 */
public record BlockQuery(
    WhereClause where,
    FilterExpression propertyFilter,
    ParentFilter parentFilter,
    RootFilter rootFilter,
    Integer limit,
    boolean includeTrashed
) {
    public BlockQuery {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        }
        where = where != null ? where : WhereClause.empty();
    }

    public static BlockQuery where(WhereClause where) {
        return builder().where(where).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WhereClause where;
        private FilterExpression propertyFilter;
        private ParentFilter parentFilter;
        private RootFilter rootFilter;
        private Integer limit;
        private boolean includeTrashed;

        private Builder() {
        }

        public Builder where(WhereClause where) { this.where = where; return this; }
        public Builder propertyFilter(FilterExpression propertyFilter) { this.propertyFilter = propertyFilter; return this; }
        public Builder parentFilter(ParentFilter parentFilter) { this.parentFilter = parentFilter; return this; }
        public Builder rootFilter(RootFilter rootFilter) { this.rootFilter = rootFilter; return this; }
        public Builder limit(Integer limit) { this.limit = limit; return this; }
        public Builder includeTrashed(boolean includeTrashed) { this.includeTrashed = includeTrashed; return this; }

        public BlockQuery build() {
            return new BlockQuery(where, propertyFilter, parentFilter, rootFilter, limit, includeTrashed);
        }
    }
}
