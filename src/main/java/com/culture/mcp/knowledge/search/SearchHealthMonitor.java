package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.domain.SearchHealth;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Counts read-path failures that were converted into empty results. */
public class SearchHealthMonitor {

    private final AtomicLong failedSearches = new AtomicLong();
    private final AtomicLong failedExcerpts = new AtomicLong();
    private volatile Instant lastFailureAt;
    private volatile String lastFailureMessage;

    public void recordSearchFailure(Exception e) {
        failedSearches.incrementAndGet();
        remember(e);
    }

    public void recordExcerptFailure(Exception e) {
        failedExcerpts.incrementAndGet();
        remember(e);
    }

    private void remember(Exception e) {
        lastFailureAt = Instant.now();
        lastFailureMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    public SearchHealth snapshot(boolean indexAvailable) {
        return new SearchHealth(indexAvailable, failedSearches.get(), failedExcerpts.get(),
                lastFailureAt, lastFailureMessage);
    }
}
