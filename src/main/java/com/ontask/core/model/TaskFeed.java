package com.ontask.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot handed to the presentation layer: everything loaded so far, ranked,
 * plus whether another page can be requested.
 */
public record TaskFeed(
    List<RankedTask> tasks,
    RankedTask topTask,
    boolean hasMore
) implements Serializable {

    public TaskFeed {
        tasks = List.copyOf(tasks);
    }

    public static TaskFeed empty() {
        return new TaskFeed(List.of(), null, false);
    }

    public Optional<RankedTask> top() {
        return Optional.ofNullable(topTask);
    }

    public int size() {
        return tasks.size();
    }
}
