package com.ontask.core.engine;

import com.ontask.core.config.OnTaskProperties;
import com.ontask.core.filter.StatusFilter;
import com.ontask.core.filter.StatusFilterCompiler;
import com.ontask.core.model.RankingResult;
import com.ontask.core.model.ScanBatch;
import com.ontask.core.model.ScanScope;
import com.ontask.core.model.TaskFeed;
import com.ontask.core.model.TaskLine;
import com.ontask.core.rank.TaskRanker;
import com.ontask.core.scan.ScanSession;
import com.ontask.core.scan.ScanSessionStateException;
import com.ontask.core.scan.TaskScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one scan session on behalf of a view: full refreshes, "load more" pages,
 * and re-ranking of everything loaded so far after each page.
 * <p>
 * All state is guarded by this instance's monitor, so calls from different threads run
 * one after another. A refresh requested from inside a running refresh (for example by a
 * {@link com.ontask.core.rank.TopTaskListener} reacting to the new top task) is not nested;
 * the latest such request is remembered and run once, right after the running one
 * finishes. A refresh that fails discards the requests queued behind it.
 */
@Service
public class TaskFeedService {

    private static final Logger log = LoggerFactory.getLogger(TaskFeedService.class);

    private final TaskScanner scanner;
    private final TaskRanker ranker;
    private final StatusFilterCompiler filterCompiler;
    private final OnTaskProperties properties;

    private boolean refreshing;
    private FeedRequest pendingRefresh;

    private ScanSession session;
    private FeedRequest request;
    private StatusFilter filter;
    private List<TaskLine> loaded = List.of();
    private TaskFeed current = TaskFeed.empty();

    public TaskFeedService(TaskScanner scanner, TaskRanker ranker,
                           StatusFilterCompiler filterCompiler, OnTaskProperties properties) {
        this.scanner = scanner;
        this.ranker = ranker;
        this.filterCompiler = filterCompiler;
        this.properties = properties;
    }

    /** Request built from configuration: configured scope, statuses, page size and tiers. */
    public FeedRequest defaultRequest() {
        return new FeedRequest(
                properties.isOnlyShowToday() ? ScanScope.today() : ScanScope.all(),
                StatusFilterCompiler.filterSetOf(properties.getStatusConfigs()),
                properties.getLoadMoreLimit(),
                properties.getRankTiers());
    }

    public synchronized TaskFeed refresh() {
        return refresh(defaultRequest());
    }

    /**
     * Starts over: rebuilds the document list, loads the first page and ranks it.
     *
     * @return the new feed, or the current one if this request was coalesced into a running refresh
     */
    public synchronized TaskFeed refresh(FeedRequest feedRequest) {
        if (refreshing) {
            pendingRefresh = feedRequest;
            log.debug("Refresh already running, queued trailing refresh");
            return current;
        }
        refreshing = true;
        try {
            TaskFeed feed = doRefresh(feedRequest);
            while (pendingRefresh != null) {
                FeedRequest trailing = pendingRefresh;
                pendingRefresh = null;
                log.debug("Running coalesced trailing refresh");
                feed = doRefresh(trailing);
            }
            return feed;
        } catch (RuntimeException e) {
            if (pendingRefresh != null) {
                log.warn("Refresh failed, dropping queued refresh: {}", e.getMessage());
                pendingRefresh = null;
            }
            throw e;
        } finally {
            refreshing = false;
        }
    }

    /**
     * Loads the next page and re-ranks everything loaded so far.
     *
     * @throws ScanSessionStateException if no refresh has run yet, or after {@link #clear()}
     */
    public synchronized TaskFeed loadMore() {
        if (session == null || !session.isInitialized()) {
            throw new ScanSessionStateException("No active task feed; call refresh() first");
        }
        ScanBatch batch = session.fetchNextBatch(request.pageSize(), filter);
        var all = new ArrayList<TaskLine>(loaded.size() + batch.size());
        all.addAll(loaded);
        all.addAll(batch.tasks());
        loaded = List.copyOf(all);
        log.info("Loaded {} more tasks ({} total), hasMore={}", batch.size(), loaded.size(), batch.hasMore());
        return publish(batch.hasMore());
    }

    /** Loads pages until the document list is exhausted. */
    public synchronized TaskFeed loadAll() {
        TaskFeed feed = current;
        while (feed.hasMore()) {
            feed = loadMore();
        }
        return feed;
    }

    /** Latest feed snapshot. */
    public synchronized TaskFeed current() {
        return current;
    }

    /** Drops the session and everything loaded. */
    public synchronized void clear() {
        if (session != null && session.isInitialized()) {
            session.reset();
        }
        loaded = List.of();
        current = TaskFeed.empty();
    }

    private TaskFeed doRefresh(FeedRequest feedRequest) {
        if (session == null) {
            session = scanner.openSession();
        } else if (session.isInitialized()) {
            session.reset();
        }
        request = feedRequest;
        filter = filterCompiler.compile(feedRequest.statusFilters());
        session.initialize(feedRequest.scope());

        ScanBatch batch = session.fetchNextBatch(feedRequest.pageSize(), filter);
        loaded = batch.tasks();
        log.info("Refreshed feed: {} tasks from {} documents, hasMore={}",
                loaded.size(), session.getDocuments().size(), batch.hasMore());
        return publish(batch.hasMore());
    }

    private TaskFeed publish(boolean hasMore) {
        RankingResult ranking = ranker.rank(loaded, request.tiers());
        current = new TaskFeed(ranking.rankedTasks(), ranking.topTask(), hasMore);
        return current;
    }
}
