package com.ontask.core.store;

/**
 * Thrown when a document listed earlier no longer exists.
 */
public class DocumentNotFoundException extends DocumentStoreException {
    public DocumentNotFoundException(String documentId) {
        super(documentId, "Document not found: " + documentId);
    }

    public DocumentNotFoundException(String documentId, Throwable cause) {
        super(documentId, "Document not found: " + documentId, cause);
    }
}
