package com.blockstore.repository.filter;

public enum FilterOperator {
    EQUALS,
    NOT_EQUALS,
    IN,
    CONTAINS
}
