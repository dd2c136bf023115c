package com.ontask.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Display metadata and filter flag for one checkbox status.
 *
 * @param symbol      the single character used inside the checkbox brackets
 * @param name        short label (e.g. "In Progress")
 * @param description longer hint shown next to the label
 * @param filtered    whether tasks with this status are included in scans
 */
public record StatusConfig(
    String symbol,
    String name,
    String description,
    boolean filtered
) implements Serializable {

    public static List<StatusConfig> defaults() {
        return List.of(
                new StatusConfig(".", "To-do", "Not started", true),
                new StatusConfig("+", "Next", "Next up, on deck", true),
                new StatusConfig("/", "In Progress", "Incomplete", true),
                new StatusConfig("x", "Done", "Completed", true),
                new StatusConfig("!", "Important", "Top task", true),
                new StatusConfig("*", "Star", "Marked", true),
                new StatusConfig("?", "Question", "Needs clarification", true),
                new StatusConfig("r", "Review", "In review", true),
                new StatusConfig("b", "Blocked", "Can't continue", true),
                new StatusConfig("<", "Scheduled", "On the calendar", true),
                new StatusConfig(">", "Forward", "Another day", true),
                new StatusConfig("#", "Backburner", "Indefinitely delayed", true),
                new StatusConfig("-", "Cancelled", "Not doing", true)
        );
    }
}
