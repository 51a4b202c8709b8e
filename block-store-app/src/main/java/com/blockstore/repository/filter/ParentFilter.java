package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

/** Matches blocks whose direct parent satisfies the clause and expression. */
public record ParentFilter(WhereClause where, FilterExpression expression) implements RelatedBlockFilter {

    public ParentFilter {
        if (where == null && expression == null) {
            throw new FilterValidationException("ParentFilter needs a where clause or a filter expression.");
        }
        where = where != null ? where : WhereClause.empty();
    }

    public static ParentFilter where(WhereClause where) {
        return new ParentFilter(where, null);
    }

    public static ParentFilter matching(FilterExpression expression) {
        return new ParentFilter(null, expression);
    }
}
