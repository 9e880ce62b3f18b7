package com.culture.mcp.knowledge.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A normalized document record as it is stored in the search index.
 * Produced by source connectors and by the published-document feed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IndexedDocument(
        String id,
        String title,
        String content,
        String category,
        String sourceType,
        String author,
        String filePath,
        Instant createdAt,
        Instant updatedAt
) {}
