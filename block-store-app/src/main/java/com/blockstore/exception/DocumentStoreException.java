package com.blockstore.exception;

/** Policy violation detected by the document store façade. */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
