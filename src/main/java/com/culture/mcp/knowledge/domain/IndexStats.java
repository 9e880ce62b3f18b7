package com.culture.mcp.knowledge.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IndexStats(
        long totalDocuments,
        Map<String, Long> categories,
        Map<String, Long> sources
) {

    public static IndexStats empty() {
        return new IndexStats(0, Map.of(), Map.of());
    }
}
