package com.blockstore.repository.filter;

/**
 * Node of a semantic filter: either a {@link PropertyFilter} leaf or a
 * {@link BooleanFilter} combining other expressions.
 */
public interface FilterExpression {
}
