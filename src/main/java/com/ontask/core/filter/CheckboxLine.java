package com.ontask.core.filter;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checkbox recognition: optional indentation, a list dash, a single-character
 * bracket token, whitespace, then arbitrary text.
 *
 * <pre>
 *   - [ ] plain to-do
 *     - [/] nested, in progress
 * </pre>
 *
 * @param status the character between the brackets
 * @param text   everything after the token, stripped
 */
public record CheckboxLine(char status, String text) {

    private static final Pattern CHECKBOX = Pattern.compile("^\\s*-\\s*\\[(.)\\]\\s(.*)");

    /**
     * Parses a raw document line.
     *
     * @return the checkbox, or empty if the line is not a task line
     */
    public static Optional<CheckboxLine> parse(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = CHECKBOX.matcher(line);
        // lookingAt: trailing \r or other line terminators must not reject the line
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        String token = m.group(1);
        if (token.length() != 1) {
            // supplementary code point, cannot be a status symbol
            return Optional.empty();
        }
        return Optional.of(new CheckboxLine(token.charAt(0), m.group(2).strip()));
    }

    /**
     * Rewrites the status token of a raw line, leaving indentation, text and any trailing
     * line terminator untouched.
     *
     * @return the rewritten line, or empty if the line is not a task line
     */
    public static Optional<String> withStatus(String line, char status) {
        if (parse(line).isEmpty()) {
            return Optional.empty();
        }
        Matcher m = CHECKBOX.matcher(line);
        m.lookingAt();
        return Optional.of(line.substring(0, m.start(1)) + status + line.substring(m.end(1)));
    }

    /** {@code true} for the completed status ({@code x} or {@code X}). */
    public static boolean isCompleted(char status) {
        return status == 'x' || status == 'X';
    }

    public boolean completed() {
        return isCompleted(status);
    }
}
