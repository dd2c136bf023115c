package com.ontask.core.model;

import java.io.Serializable;

/**
 * A {@link TaskLine} annotated by the ranker.
 *
 * @param task the underlying task line
 * @param rank tier priority of the task's status, or {@code null} when its status belongs to no tier
 * @param top  whether this task is the currently selected top task
 */
public record RankedTask(
    TaskLine task,
    Integer rank,
    boolean top
) implements Serializable {

    public static RankedTask unranked(TaskLine task) {
        return new RankedTask(task, null, false);
    }

    public boolean isRanked() {
        return rank != null;
    }
}
