package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

/** Matches blocks whose root block satisfies the clause and expression. */
public record RootFilter(WhereClause where, FilterExpression expression) implements RelatedBlockFilter {

    public RootFilter {
        if (where == null && expression == null) {
            throw new FilterValidationException("RootFilter needs a where clause or a filter expression.");
        }
        where = where != null ? where : WhereClause.empty();
    }

    public static RootFilter where(WhereClause where) {
        return new RootFilter(where, null);
    }

    public static RootFilter matching(FilterExpression expression) {
        return new RootFilter(null, expression);
    }
}
