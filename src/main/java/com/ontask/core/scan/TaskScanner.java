package com.ontask.core.scan;

import com.ontask.core.filter.CheckboxLine;
import com.ontask.core.filter.StatusFilter;
import com.ontask.core.logging.MdcContext;
import com.ontask.core.metrics.OnTaskMetrics;
import com.ontask.core.model.ScanBatch;
import com.ontask.core.model.ScanCursor;
import com.ontask.core.model.TaskLine;
import com.ontask.core.source.DocumentAggregator;
import com.ontask.core.store.DocumentNotFoundException;
import com.ontask.core.store.DocumentReadException;
import com.ontask.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads documents lazily, one at a time and in list order, and cuts their matching
 * checkbox lines into bounded batches.
 * <p>
 * {@link #scan} is a pure step over an explicit {@link ScanCursor}: given the same documents,
 * content and filter it always returns the same batch and next cursor. Repeated calls that
 * thread the returned cursor yield, concatenated, exactly the lines a single unbounded call
 * would, in the same order.
 * <p>
 * A batch ends as soon as the target count is reached, even on the last match of a document;
 * the cursor then stays on that document and {@code hasMore} is reported {@code true} until a
 * later call walks past it. {@code hasMore} is {@code false} only when the cursor has moved
 * beyond the last document.
 */
@Service
public class TaskScanner {

    private static final Logger log = LoggerFactory.getLogger(TaskScanner.class);

    private final DocumentAggregator aggregator;
    private final DocumentStore store;
    private final OnTaskMetrics metrics;

    public TaskScanner(DocumentAggregator aggregator, DocumentStore store, OnTaskMetrics metrics) {
        this.aggregator = aggregator;
        this.store = store;
        this.metrics = metrics;
    }

    /** Opens a new, uninitialized session owning its own document list and cursor. */
    public ScanSession openSession() {
        String id = "scan-" + UUID.randomUUID().toString().substring(0, 8);
        return new ScanSession(id, this, aggregator);
    }

    /**
     * Fetches up to {@code targetCount} matching lines starting at {@code cursor}.
     *
     * @param documents   the session's ordered document list
     * @param cursor      where the previous batch stopped
     * @param targetCount maximum number of lines to return
     * @param filter      compiled status filter
     * @param scanId      session id for log correlation
     * @return the batch and the cursor to resume from
     */
    public ScanBatch scan(List<String> documents, ScanCursor cursor, int targetCount,
                          StatusFilter filter, String scanId) {
        if (targetCount < 0) {
            throw new IllegalArgumentException("targetCount must be >= 0, got " + targetCount);
        }
        long started = System.currentTimeMillis();
        int documentCount = documents.size();

        if (filter.matchesNothing()) {
            log.info("Status filter excludes every symbol, skipping {} documents", documentCount);
            var end = new ScanCursor(Math.max(documentCount, cursor.documentIndex()), 0);
            return new ScanBatch(List.of(), end, false);
        }

        log.debug("Scanning for {} tasks from cursor {} over {} documents using {}",
                targetCount, cursor, documentCount, filter);

        var result = new ArrayList<TaskLine>();
        ScanCursor next = cursor;
        int di = cursor.documentIndex();
        try {
            while (di < documentCount && result.size() < targetCount) {
                String documentId = documents.get(di);
                int start = di == cursor.documentIndex() ? cursor.matchIndex() : 0;
                MdcContext.setDocument(scanId, di);

                List<TaskLine> matches;
                try {
                    matches = findMatches(documentId, store.readDocument(documentId), filter);
                } catch (DocumentNotFoundException e) {
                    log.warn("Skipping document {}: not found", documentId);
                    metrics.incrementReadFailures("not_found");
                    di++;
                    next = new ScanCursor(di, 0);
                    continue;
                } catch (DocumentReadException e) {
                    log.warn("Skipping document {}: {}", documentId, e.getMessage());
                    metrics.incrementReadFailures("read_error");
                    di++;
                    next = new ScanCursor(di, 0);
                    continue;
                }

                int available = Math.max(0, matches.size() - start);
                int take = Math.min(targetCount - result.size(), available);
                if (take > 0) {
                    result.addAll(matches.subList(start, start + take));
                }
                log.debug("Document {}/{} {}: {} matches, took {} from offset {} ({}/{})",
                        di + 1, documentCount, documentId, matches.size(), take, start,
                        result.size(), targetCount);

                if (result.size() == targetCount) {
                    next = new ScanCursor(di, start + take);
                    log.info("Batch full: {} tasks, stopped at {} ({} of {} matches in {})",
                            result.size(), next, start + take, matches.size(), documentId);
                    return finish(result, next, true, started);
                }

                di++;
                next = new ScanCursor(di, 0);
            }
        } finally {
            MdcContext.clearDocument();
        }

        boolean hasMore = di < documentCount;
        log.info("Batch: {} tasks, cursor {}, hasMore={}", result.size(), next, hasMore);
        return finish(result, next, hasMore, started);
    }

    /**
     * Extracts the ordered match list of one document.
     */
    List<TaskLine> findMatches(String documentId, String content, StatusFilter filter) {
        var matches = new ArrayList<TaskLine>();
        if (content == null || content.isEmpty()) {
            return matches;
        }
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            var checkbox = CheckboxLine.parse(line);
            if (checkbox.isPresent() && filter.includes(checkbox.get().status())) {
                matches.add(new TaskLine(documentId, i + 1, line.strip(), checkbox.get().status()));
            }
        }
        return matches;
    }

    private ScanBatch finish(List<TaskLine> result, ScanCursor next, boolean hasMore, long started) {
        metrics.recordBatch(result.size(), System.currentTimeMillis() - started);
        return new ScanBatch(result, next, hasMore);
    }
}
