package com.culture.mcp.knowledge.mcp;

import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.SearchPage;
import com.culture.mcp.knowledge.service.KnowledgeSearchService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * Search operations published as MCP tools.
 */
@Component
public class KnowledgeSearchTools {

    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 50;

    private final KnowledgeSearchService searchService;

    public KnowledgeSearchTools(KnowledgeSearchService searchService) {
        this.searchService = searchService;
    }

    @Tool(
            name = "searchKnowledge",
            description = """
        Full-text search over the team knowledge base (synced repositories, wiki spaces and local docs).
        Pass FREE-FORM text in Chinese or English; the service segments it and matches titles and content,
        tolerating typos and partial words. Title matches rank higher than content matches.

        Inputs:
        - query: string
        - category: exact category name (optional)
        - sourceType: exact source type such as "gitlab", "confluence" or "local" (optional)
        - limit: integer (optional, default 10, max 50)

        Returns ranked hits with id, title, file path, category, source type, author, update time,
        score and an excerpt where matched terms are wrapped in **bold**.
        If there are no hits, say so. Do not invent documents.
        """
    )
    public SearchPage searchKnowledge(
            @ToolParam(description = "Free-form search text") String query,
            @ToolParam(description = "Exact category filter", required = false) String category,
            @ToolParam(description = "Exact source type filter", required = false) String sourceType,
            @ToolParam(description = "Maximum number of hits", required = false) Integer limit) {
        int size = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
        return searchService.search(query, category, sourceType, size, 0).join();
    }

    @Tool(
            name = "getIndexStats",
            description = """
        Returns how many documents are searchable, broken down by category and by source type.
        Use it to discover valid category and source type filter values.
        """
    )
    public IndexStats getIndexStats() {
        return searchService.getStats().join();
    }
}
