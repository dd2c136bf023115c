package com.ontask.core.store;

import java.time.Instant;
import java.util.List;

/**
 * Host storage the scanner reads from and status updates write back to. Identifiers are
 * {@code /}-separated paths relative to the store root, e.g. {@code Journal/2024-01-15.md}.
 * <p>
 * Content is never cached by callers; every scan re-reads through this interface.
 */
public interface DocumentStore {

    /**
     * Lists every document in the store.
     *
     * @throws DocumentStoreException if the store cannot be enumerated
     */
    List<String> listDocuments();

    /** {@code true} if the id names an existing document or folder. */
    boolean exists(String id);

    /** {@code true} if the id names an existing document (not a folder). */
    boolean isDocument(String id);

    /**
     * Reads the full text of a document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     * @throws DocumentReadException     if it exists but cannot be read
     */
    String readDocument(String id);

    /**
     * Replaces the full text of an existing document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     * @throws DocumentWriteException    if it exists but cannot be written
     */
    void writeDocument(String id, String content);

    /**
     * Last-modified time of a document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     * @throws DocumentReadException     if the timestamp cannot be read
     */
    Instant getRecency(String id);

    /** Trailing filename component of an identifier. */
    static String fileName(String id) {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }
}
