package com.blockstore.exception;

/** A filter was constructed with an empty path, a wrongly shaped value or missing operands. */
public class FilterValidationException extends IllegalArgumentException {

    public FilterValidationException(String message) {
        super(message);
    }
}
