package com.culture.mcp.knowledge.service;

import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.IndexedDocument;
import com.culture.mcp.knowledge.domain.SearchHealth;
import com.culture.mcp.knowledge.domain.SearchPage;
import com.culture.mcp.knowledge.feed.FeedUnavailableException;
import com.culture.mcp.knowledge.feed.PublishedDocumentFeed;
import com.culture.mcp.knowledge.index.IndexStore;
import com.culture.mcp.knowledge.search.DocumentSearcher;
import com.culture.mcp.knowledge.search.SearchHealthMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Implementation of the KnowledgeSearchService on top of the Lucene index.
 * Index I/O is blocking, so each call is handed to the search executor and the
 * caller only awaits the future.
 */
@Service
public class LuceneKnowledgeSearchService implements KnowledgeSearchService {

    private static final Logger log = LoggerFactory.getLogger(LuceneKnowledgeSearchService.class);

    private final IndexStore store;
    private final DocumentSearcher searcher;
    private final IndexMaintenance maintenance;
    private final SearchHealthMonitor health;
    private final Executor executor;
    private final ObjectProvider<PublishedDocumentFeed> feed;

    public LuceneKnowledgeSearchService(IndexStore store,
                                        DocumentSearcher searcher,
                                        IndexMaintenance maintenance,
                                        SearchHealthMonitor health,
                                        @Qualifier("searchExecutor") Executor executor,
                                        ObjectProvider<PublishedDocumentFeed> feed) {
        this.store = store;
        this.searcher = searcher;
        this.maintenance = maintenance;
        this.health = health;
        this.executor = executor;
        this.feed = feed;
    }

    @Override
    public CompletableFuture<SearchPage> search(String query, String category, String sourceType, int limit, int offset) {
        return CompletableFuture.supplyAsync(
                () -> searcher.search(query, category, sourceType, limit, offset), executor);
    }

    @Override
    public CompletableFuture<IndexStats> getStats() {
        return CompletableFuture.supplyAsync(maintenance::stats, executor);
    }

    @Override
    public SearchHealth getHealth() {
        return health.snapshot(store.isAvailable());
    }

    @Override
    public CompletableFuture<Void> addDocument(IndexedDocument document) {
        return CompletableFuture.runAsync(() -> maintenance.add(document), executor);
    }

    @Override
    public CompletableFuture<Void> updateDocument(IndexedDocument document) {
        return CompletableFuture.runAsync(() -> maintenance.update(document), executor);
    }

    @Override
    public CompletableFuture<Void> deleteDocument(String id) {
        return CompletableFuture.runAsync(() -> maintenance.delete(id), executor);
    }

    @Override
    public CompletableFuture<Void> rebuildIndex(List<IndexedDocument> documents) {
        List<IndexedDocument> snapshot = List.copyOf(documents);
        return CompletableFuture.runAsync(() -> maintenance.rebuild(snapshot), executor);
    }

    @Override
    public CompletableFuture<Integer> rebuildFromFeed() {
        return CompletableFuture.supplyAsync(() -> {
            PublishedDocumentFeed source = feed.getIfAvailable();
            if (source == null) {
                throw new FeedUnavailableException("No published document feed is configured");
            }
            List<IndexedDocument> documents = source.listPublishedDocuments();
            log.info("Rebuilding search index from feed documents={}", documents.size());
            maintenance.rebuild(documents);
            return documents.size();
        }, executor);
    }
}
