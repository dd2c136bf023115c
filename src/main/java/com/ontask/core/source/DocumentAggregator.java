package com.ontask.core.source;

import com.ontask.core.model.ScanScope;
import com.ontask.core.store.DocumentStore;
import com.ontask.core.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builds the ordered document list of a scan session.
 * <p>
 * The store is listed once and that listing is shared by every origin. If the listing
 * fails, origins see an empty vault. Ids from every available origin are unioned in origin
 * order and deduplicated. When the
 * scope is restricted to the current period, non-matching documents are dropped. The result
 * is sorted by trailing filename, descending, so later-dated notes come first; ties keep
 * union order.
 */
public class DocumentAggregator {

    private static final Logger log = LoggerFactory.getLogger(DocumentAggregator.class);

    static final Comparator<String> BY_FILENAME_DESCENDING =
            Comparator.comparing(DocumentStore::fileName, Comparator.reverseOrder());

    private final List<DocumentOrigin> origins;
    private final PeriodMatcher periodMatcher;
    private final DocumentStore store;
    private final boolean includeModifiedToday;

    public DocumentAggregator(List<DocumentOrigin> origins, PeriodMatcher periodMatcher,
                              DocumentStore store, boolean includeModifiedToday) {
        this.origins = List.copyOf(origins);
        this.periodMatcher = periodMatcher;
        this.store = store;
        this.includeModifiedToday = includeModifiedToday;
    }

    /**
     * Lists, deduplicates, scopes and orders candidate documents.
     *
     * @param scope restrictions for this session
     * @return a new mutable list in scan order
     */
    public List<String> listDocuments(ScanScope scope) {
        List<String> vault = listVault();
        var union = new LinkedHashSet<String>();
        for (DocumentOrigin origin : origins) {
            if (!origin.isAvailable()) {
                log.debug("Origin {} not configured, skipping", origin.name());
                continue;
            }
            try {
                List<String> contributed = origin.listCandidateDocuments(scope, vault);
                union.addAll(contributed);
                log.debug("Origin {} contributed {} documents", origin.name(), contributed.size());
            } catch (RuntimeException e) {
                log.warn("Origin {} unavailable, contributing nothing: {}", origin.name(), e.getMessage(), e);
            }
        }

        var documents = new ArrayList<String>(union.size());
        for (String id : union) {
            if (!scope.onlyCurrentPeriod() || inCurrentPeriod(id)) {
                documents.add(id);
            }
        }
        documents.sort(BY_FILENAME_DESCENDING);

        log.info("Aggregated {} documents ({} before scoping) from {} origins{}",
                documents.size(), union.size(), origins.size(),
                scope.onlyCurrentPeriod() ? " for " + periodMatcher.today() : "");
        return documents;
    }

    private List<String> listVault() {
        try {
            return List.copyOf(store.listDocuments());
        } catch (DocumentStoreException e) {
            log.warn("Could not list documents, origins see an empty vault: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private boolean inCurrentPeriod(String id) {
        if (periodMatcher.matchesIdentifier(id)) {
            return true;
        }
        if (!includeModifiedToday) {
            return false;
        }
        try {
            return periodMatcher.matchesRecency(store.getRecency(id));
        } catch (DocumentStoreException e) {
            log.debug("Could not read recency of {}: {}", id, e.getMessage());
            return false;
        }
    }
}
