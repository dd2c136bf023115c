package com.ontask.core.store;

/**
 * Thrown when a document exists but its new content cannot be written.
 */
public class DocumentWriteException extends DocumentStoreException {
    public DocumentWriteException(String documentId, String message, Throwable cause) {
        super(documentId, message, cause);
    }
}
