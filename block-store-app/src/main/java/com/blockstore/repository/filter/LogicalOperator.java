package com.blockstore.repository.filter;

public enum LogicalOperator {
    AND,
    OR,
    NOT
}
