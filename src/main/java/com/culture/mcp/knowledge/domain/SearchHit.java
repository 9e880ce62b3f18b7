package com.culture.mcp.knowledge.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchHit(
        String id,
        String title,
        String filePath,
        String category,
        String sourceType,
        String author,
        Instant updatedAt,
        float score,
        String excerpt
) {}
