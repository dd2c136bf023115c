package com.ontask.core.scan;

import com.ontask.core.filter.StatusFilter;
import com.ontask.core.logging.MdcContext;
import com.ontask.core.model.ScanBatch;
import com.ontask.core.model.ScanCursor;
import com.ontask.core.model.ScanScope;
import com.ontask.core.source.DocumentAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One paginated pass over a fixed, ordered document list.
 * <p>
 * Lifecycle: {@link #initialize} builds the list and puts the cursor at the start;
 * {@link #fetchNextBatch} advances it; {@link #reset} discards both. Fetching on a session
 * that is not initialized fails with {@link ScanSessionStateException}, as does any call
 * issued while another call on the same session is still running.
 */
public class ScanSession {

    private static final Logger log = LoggerFactory.getLogger(ScanSession.class);

    private final String id;
    private final TaskScanner scanner;
    private final DocumentAggregator aggregator;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private List<String> documents;
    private ScanCursor cursor;

    ScanSession(String id, TaskScanner scanner, DocumentAggregator aggregator) {
        this.id = id;
        this.scanner = scanner;
        this.aggregator = aggregator;
    }

    /**
     * Rebuilds the ordered document list and moves the cursor to the start.
     */
    public void initialize(ScanScope scope) {
        enter("initialize");
        try {
            MdcContext.setScan(id);
            documents = List.copyOf(aggregator.listDocuments(scope));
            cursor = ScanCursor.START;
            log.info("Initialized scan over {} documents (scope={})", documents.size(), scope);
        } finally {
            MdcContext.clear();
            exit();
        }
    }

    /**
     * Returns up to {@code targetCount} further matching lines.
     *
     * @throws ScanSessionStateException if the session is not initialized
     */
    public ScanBatch fetchNextBatch(int targetCount, StatusFilter filter) {
        enter("fetchNextBatch");
        try {
            if (documents == null) {
                throw new ScanSessionStateException(
                        "Scan session " + id + " is not initialized; call initialize() first");
            }
            MdcContext.setScan(id);
            ScanBatch batch = scanner.scan(documents, cursor, targetCount, filter, id);
            cursor = batch.cursor();
            return batch;
        } finally {
            MdcContext.clear();
            exit();
        }
    }

    /** Discards the document list and cursor; the session must be initialized again. */
    public void reset() {
        enter("reset");
        try {
            documents = null;
            cursor = null;
            log.debug("Reset scan session {}", id);
        } finally {
            exit();
        }
    }

    public String getId() {
        return id;
    }

    public boolean isInitialized() {
        return documents != null;
    }

    /** Current cursor, or {@code null} when not initialized. */
    public ScanCursor getCursor() {
        return cursor;
    }

    /** The ordered document list, or an empty list when not initialized. */
    public List<String> getDocuments() {
        return documents == null ? List.of() : documents;
    }

    private void enter(String operation) {
        if (!busy.compareAndSet(false, true)) {
            throw new ScanSessionStateException(
                    "Scan session " + id + " is busy; " + operation + " must not overlap another call");
        }
    }

    private void exit() {
        busy.set(false);
    }
}
