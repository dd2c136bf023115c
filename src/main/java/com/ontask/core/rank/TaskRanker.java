package com.ontask.core.rank;

import com.ontask.core.metrics.OnTaskMetrics;
import com.ontask.core.model.RankTier;
import com.ontask.core.model.RankedTask;
import com.ontask.core.model.RankingResult;
import com.ontask.core.model.TaskLine;
import com.ontask.core.store.DocumentStore;
import com.ontask.core.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Selects the single top task from the tasks loaded so far.
 * <p>
 * Tiers are visited in ascending priority. Every task whose status belongs to a tier is
 * labelled with that tier's priority; a symbol listed in several tiers ends up with the
 * label of the last one visited. The first tier with any task supplies the winner: its
 * task from the most recently modified document (earliest in input order on equal timestamps).
 * Later tiers are still labelled but never replace the winner.
 * <p>
 * Input lists are never modified; each call returns a new annotated snapshot and notifies
 * subscribed {@link TopTaskListener}s. Ranking only looks at what it is given and never
 * triggers a scan.
 */
@Service
public class TaskRanker {

    private static final Logger log = LoggerFactory.getLogger(TaskRanker.class);

    private final DocumentStore store;
    private final OnTaskMetrics metrics;
    private final CopyOnWriteArrayList<TopTaskListener> listeners = new CopyOnWriteArrayList<>();

    public TaskRanker(DocumentStore store, OnTaskMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Ranks a task snapshot.
     *
     * @param tasks tasks loaded so far, in display order
     * @param tiers rank tiers in any order
     * @return annotated tasks in input order plus the top task, if any
     */
    public RankingResult rank(List<TaskLine> tasks, List<RankTier> tiers) {
        var orderedTiers = new ArrayList<>(tiers);
        orderedTiers.sort(Comparator.comparingInt(RankTier::priority));

        Integer[] ranks = new Integer[tasks.size()];
        Map<String, Instant> recencyCache = new HashMap<>();
        int winner = -1;

        for (RankTier tier : orderedTiers) {
            int matched = 0;
            int best = -1;
            Instant bestRecency = null;
            for (int i = 0; i < tasks.size(); i++) {
                TaskLine task = tasks.get(i);
                if (task.statusSymbol() != tier.statusSymbol()) {
                    continue;
                }
                matched++;
                ranks[i] = tier.priority();
                if (winner < 0) {
                    Instant recency = recencyCache.computeIfAbsent(task.documentId(), this::recencyOf);
                    if (best < 0 || recency.isAfter(bestRecency)) {
                        best = i;
                        bestRecency = recency;
                    }
                }
            }
            log.debug("Tier '{}' (priority {}): {} tasks", tier.statusSymbol(), tier.priority(), matched);
            if (winner < 0 && best >= 0) {
                winner = best;
                log.debug("Tier '{}' supplies the top task: {}", tier.statusSymbol(), tasks.get(best).rawLine());
            }
        }

        var ranked = new ArrayList<RankedTask>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            ranked.add(new RankedTask(tasks.get(i), ranks[i], i == winner));
        }

        RankingResult result = new RankingResult(ranked, winner >= 0 ? ranked.get(winner) : null);
        if (result.topTask() != null) {
            log.info("Top task: {} ({}:{})", result.topTask().task().rawLine(),
                    result.topTask().task().documentId(), result.topTask().task().lineNumber());
            metrics.recordTopTask(true);
            publish(TopTaskEvent.found(result.topTask()));
        } else {
            log.info("No top task among {} tasks", tasks.size());
            metrics.recordTopTask(false);
            publish(TopTaskEvent.cleared());
        }
        return result;
    }

    /**
     * Re-ranks a previously ranked snapshot, discarding its old annotations.
     */
    public RankingResult rerank(List<RankedTask> snapshot, List<RankTier> tiers) {
        return rank(snapshot.stream().map(RankedTask::task).toList(), tiers);
    }

    /**
     * Subscribe to top-task notifications.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(TopTaskListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Instant recencyOf(String documentId) {
        try {
            Instant recency = store.getRecency(documentId);
            return recency != null ? recency : Instant.EPOCH;
        } catch (DocumentStoreException e) {
            log.debug("No recency for {}, treating as oldest: {}", documentId, e.getMessage());
            return Instant.EPOCH;
        }
    }

    private void publish(TopTaskEvent event) {
        for (TopTaskListener listener : listeners) {
            try {
                listener.onTopTask(event);
            } catch (Exception e) {
                log.warn("Listener threw exception processing {} event: {}",
                        event.type(), e.getMessage(), e);
            }
        }
    }
}
