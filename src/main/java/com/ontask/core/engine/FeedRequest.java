package com.ontask.core.engine;

import com.ontask.core.model.RankTier;
import com.ontask.core.model.ScanScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of one feed: what to scan, which statuses to keep, page size and rank tiers.
 *
 * @param scope         document scope
 * @param statusFilters {@code symbol -> included} map
 * @param pageSize      target task count per page
 * @param tiers         rank tiers for top-task selection
 */
public record FeedRequest(
    ScanScope scope,
    Map<String, Boolean> statusFilters,
    int pageSize,
    List<RankTier> tiers
) {

    public FeedRequest {
        if (pageSize < 0) {
            throw new IllegalArgumentException("pageSize must be >= 0, got " + pageSize);
        }
        statusFilters = Collections.unmodifiableMap(new LinkedHashMap<>(statusFilters));
        tiers = List.copyOf(tiers);
    }

    public FeedRequest withScope(ScanScope scope) {
        return new FeedRequest(scope, statusFilters, pageSize, tiers);
    }

    public FeedRequest withPageSize(int pageSize) {
        return new FeedRequest(scope, statusFilters, pageSize, tiers);
    }

    public FeedRequest withStatusFilters(Map<String, Boolean> statusFilters) {
        return new FeedRequest(scope, statusFilters, pageSize, tiers);
    }
}
