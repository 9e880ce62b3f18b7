package com.culture.mcp.knowledge.service;

import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.IndexedDocument;
import com.culture.mcp.knowledge.domain.SearchHealth;
import com.culture.mcp.knowledge.domain.SearchPage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Search engine entry points used by the serving layer and the sync jobs.
 * Every call runs on the search worker pool; the returned future completes
 * once the index operation has finished.
 */
public interface KnowledgeSearchService {

    /** Never completes exceptionally; failures yield an empty page. */
    CompletableFuture<SearchPage> search(String query, String category, String sourceType, int limit, int offset);

    CompletableFuture<IndexStats> getStats();

    SearchHealth getHealth();

    CompletableFuture<Void> addDocument(IndexedDocument document);

    CompletableFuture<Void> updateDocument(IndexedDocument document);

    CompletableFuture<Void> deleteDocument(String id);

    CompletableFuture<Void> rebuildIndex(List<IndexedDocument> documents);

    /**
     * Rebuilds from the repository snapshot; returns the number of indexed documents.
     * Completes with {@link com.culture.mcp.knowledge.feed.FeedUnavailableException} when no feed is configured.
     */
    CompletableFuture<Integer> rebuildFromFeed();
}
