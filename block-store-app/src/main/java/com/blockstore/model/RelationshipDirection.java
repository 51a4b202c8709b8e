package com.blockstore.model;

public enum RelationshipDirection {
    OUTGOING,
    INCOMING,
    ALL
}
