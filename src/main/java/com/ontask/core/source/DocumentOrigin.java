package com.ontask.core.source;

import com.ontask.core.model.ScanScope;

import java.util.List;

/**
 * One independent place candidate documents come from (tagged streams, daily notes,
 * a designated folder). Implementations may throw; the {@link DocumentAggregator}
 * treats a failing origin as contributing nothing.
 */
public interface DocumentOrigin {

    /** Short name used in logs, e.g. {@code "streams"}. */
    String name();

    /** Whether this origin is configured at all. Unavailable origins are skipped without a call. */
    boolean isAvailable();

    /**
     * Candidate document ids in this origin's own order. May contain duplicates.
     *
     * @param scope          restrictions of the session being built
     * @param vaultDocuments every document in the store, listed once per aggregation
     */
    List<String> listCandidateDocuments(ScanScope scope, List<String> vaultDocuments);
}
