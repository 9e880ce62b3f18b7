package com.culture.mcp.knowledge.domain;

import java.util.List;

/** One page of ranked hits plus the number of matches before pagination. */
public record SearchPage(List<SearchHit> hits, long total) {

    public static SearchPage empty() {
        return new SearchPage(List.of(), 0);
    }
}
