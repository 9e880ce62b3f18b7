package com.culture.mcp.knowledge.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Out-of-band view of read-path degradation. A failed search returns an empty
 * page, so this is the only place where such failures become visible.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchHealth(
        boolean indexAvailable,
        long failedSearches,
        long failedExcerpts,
        Instant lastFailureAt,
        String lastFailureMessage
) {}
