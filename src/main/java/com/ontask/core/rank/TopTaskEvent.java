package com.ontask.core.rank;

import com.ontask.core.model.RankedTask;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * Emitted after every ranking pass.
 *
 * @param type      whether a top task was found or the selection was cleared
 * @param topTask   the winning task (null when cleared)
 * @param timestamp when the ranking pass completed
 */
public record TopTaskEvent(
    Type type,
    RankedTask topTask,
    Instant timestamp
) implements Serializable {

    public enum Type { FOUND, CLEARED }

    public static TopTaskEvent found(RankedTask topTask) {
        return new TopTaskEvent(Type.FOUND, topTask, Instant.now());
    }

    public static TopTaskEvent cleared() {
        return new TopTaskEvent(Type.CLEARED, null, Instant.now());
    }

    public Optional<RankedTask> top() {
        return Optional.ofNullable(topTask);
    }
}
