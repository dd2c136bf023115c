package com.ontask.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One bounded page of scan results.
 *
 * @param tasks   matching lines in document order
 * @param cursor  position the next batch resumes from
 * @param hasMore {@code false} only once the document list is exhausted
 */
public record ScanBatch(
    List<TaskLine> tasks,
    ScanCursor cursor,
    boolean hasMore
) implements Serializable {

    public ScanBatch {
        tasks = List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }
}
