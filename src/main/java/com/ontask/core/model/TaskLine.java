package com.ontask.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single checkbox line found while scanning a document.
 *
 * @param documentId   identifier of the document the line was read from
 * @param lineNumber   1-based line number within the document
 * @param rawLine      the trimmed line text, including the checkbox token
 * @param statusSymbol the character inside the checkbox brackets (e.g. {@code ' '}, {@code 'x'}, {@code '!'})
 */
public record TaskLine(
    String documentId,
    int lineNumber,
    String rawLine,
    char statusSymbol
) implements Serializable {

    public TaskLine {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(rawLine, "rawLine");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1-based, got " + lineNumber);
        }
    }

    /** Text after the checkbox token, or the whole line if it has none. */
    public String text() {
        int close = rawLine.indexOf(']');
        return close >= 0 ? rawLine.substring(close + 1).strip() : rawLine;
    }
}
