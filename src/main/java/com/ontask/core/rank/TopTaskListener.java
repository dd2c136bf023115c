package com.ontask.core.rank;

/**
 * Observer notified by {@link TaskRanker} when the top task is found or cleared.
 */
@FunctionalInterface
public interface TopTaskListener {
    void onTopTask(TopTaskEvent event);
}
