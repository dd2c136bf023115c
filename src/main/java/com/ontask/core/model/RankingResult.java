package com.ontask.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Output of one ranking pass: a fresh annotated snapshot of the input tasks (same order)
 * and the selected top task, if any.
 */
public record RankingResult(
    List<RankedTask> rankedTasks,
    RankedTask topTask
) implements Serializable {

    public RankingResult {
        rankedTasks = List.copyOf(rankedTasks);
    }

    public Optional<RankedTask> top() {
        return Optional.ofNullable(topTask);
    }
}
