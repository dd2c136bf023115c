package com.ontask.core.store;

/**
 * Base failure raised by a {@link DocumentStore}.
 */
public class DocumentStoreException extends RuntimeException {

    private final String documentId;

    public DocumentStoreException(String documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public DocumentStoreException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    /** The document involved, or {@code null} for store-wide failures. */
    public String getDocumentId() {
        return documentId;
    }
}
