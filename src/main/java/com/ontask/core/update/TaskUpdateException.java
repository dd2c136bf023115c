package com.ontask.core.update;

/**
 * Thrown when a status update cannot be applied because the target line is missing,
 * is no longer a task line, or no longer matches the task the caller saw.
 */
public class TaskUpdateException extends RuntimeException {

    private final String documentId;
    private final int lineNumber;

    public TaskUpdateException(String documentId, int lineNumber, String message) {
        super(message);
        this.documentId = documentId;
        this.lineNumber = lineNumber;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
