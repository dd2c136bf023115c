package com.ontask.core.store;

/**
 * Thrown when a document exists but its content or metadata cannot be read.
 */
public class DocumentReadException extends DocumentStoreException {
    public DocumentReadException(String documentId, String message) {
        super(documentId, message);
    }

    public DocumentReadException(String documentId, String message, Throwable cause) {
        super(documentId, message, cause);
    }
}
