package com.culture.mcp.knowledge.presentation;

import com.culture.mcp.knowledge.domain.SearchHit;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(String query, long total, List<SearchHit> results) {}
