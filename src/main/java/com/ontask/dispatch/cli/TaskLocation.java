package com.ontask.dispatch.cli;

/**
 * A task addressed on the command line as {@code <document>:<line>},
 * e.g. {@code Journal/2024-01-15.md:12}.
 */
record TaskLocation(String documentId, int lineNumber) {

    static TaskLocation parse(String text) {
        int colon = text == null ? -1 : text.lastIndexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("Expected <document>:<line>, got '" + text + "'");
        }
        int line;
        try {
            line = Integer.parseInt(text.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line number is not a number in '" + text + "'");
        }
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers start at 1, got " + line);
        }
        return new TaskLocation(text.substring(0, colon), line);
    }

    @Override
    public String toString() {
        return documentId + ":" + lineNumber;
    }
}
