package com.blockstore.repository.filter;

/**
 * Constraint on a block reached through one join: the parent row or the root row.
 */
public interface RelatedBlockFilter {

    WhereClause where();

    FilterExpression expression();
}
