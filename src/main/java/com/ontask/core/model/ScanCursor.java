package com.ontask.core.model;

import java.io.Serializable;

/**
 * Exact resume point of a paginated scan: the document being read and how many of its
 * matching lines have already been returned.
 *
 * @param documentIndex index into the session's ordered document list
 * @param matchIndex    number of matches of that document already consumed
 */
public record ScanCursor(
    int documentIndex,
    int matchIndex
) implements Serializable {

    public static final ScanCursor START = new ScanCursor(0, 0);

    public ScanCursor {
        if (documentIndex < 0 || matchIndex < 0) {
            throw new IllegalArgumentException(
                    "Cursor positions must be non-negative: (" + documentIndex + ", " + matchIndex + ")");
        }
    }

    @Override
    public String toString() {
        return "(" + documentIndex + "," + matchIndex + ")";
    }
}
