package com.blockstore.exception;

/** A structural edit would break the tree: duplicate child, self-parenting, cycle or cross-root link. */
public class InvalidChildrenException extends RepositoryException {

    public InvalidChildrenException(String message) {
        super(message);
    }
}
