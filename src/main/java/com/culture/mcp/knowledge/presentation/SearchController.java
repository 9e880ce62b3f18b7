package com.culture.mcp.knowledge.presentation;

import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.IndexedDocument;
import com.culture.mcp.knowledge.domain.SearchHealth;
import com.culture.mcp.knowledge.service.KnowledgeSearchService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
public class SearchController {

    static final int MAX_LIMIT = 100;

    private final KnowledgeSearchService searchService;

    @Autowired
    public SearchController(KnowledgeSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/search")
    public CompletableFuture<ResponseEntity<SearchResponse>> search(
            @RequestParam("q") String query,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "source_type", required = false) String sourceType,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        if (query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return searchService.search(query, category, sourceType, limit, offset)
                .thenApply(page -> ResponseEntity.ok(new SearchResponse(query, page.total(), page.hits())));
    }

    @GetMapping("/search/stats")
    public CompletableFuture<ResponseEntity<IndexStats>> stats() {
        return searchService.getStats().thenApply(ResponseEntity::ok);
    }

    /** Read-path failures are invisible in search responses; they are reported here. */
    @GetMapping("/search/health")
    public ResponseEntity<SearchHealth> health() {
        return ResponseEntity.ok(searchService.getHealth());
    }

    @PostMapping("/index/documents")
    public CompletableFuture<ResponseEntity<String>> addDocument(@RequestBody IndexedDocument document) {
        return searchService.addDocument(document)
                .thenApply(done -> ResponseEntity.ok("Document indexed: " + document.id()));
    }

    /** Upsert: creates the document when the id is not indexed yet, otherwise replaces it. */
    @PutMapping("/index/documents/{id}")
    public CompletableFuture<ResponseEntity<String>> updateDocument(@PathVariable String id,
                                                                    @RequestBody IndexedDocument document) {
        if (document.id() != null && !document.id().equals(id)) {
            throw new IllegalArgumentException("Path id " + id + " does not match document id " + document.id());
        }
        IndexedDocument withId = new IndexedDocument(id, document.title(), document.content(),
                document.category(), document.sourceType(), document.author(), document.filePath(),
                document.createdAt(), document.updatedAt());
        return searchService.updateDocument(withId)
                .thenApply(done -> ResponseEntity.ok("Document re-indexed: " + id));
    }

    @DeleteMapping("/index/documents/{id}")
    public CompletableFuture<ResponseEntity<Void>> deleteDocument(@PathVariable String id) {
        return searchService.deleteDocument(id)
                .thenApply(done -> ResponseEntity.noContent().build());
    }

    /** Full reindex from the given documents, or from the repository snapshot when no body is sent. */
    @PostMapping("/index/rebuild")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> rebuild(
            @RequestBody(required = false) List<IndexedDocument> documents) {
        if (documents == null) {
            return searchService.rebuildFromFeed()
                    .thenApply(count -> ResponseEntity.ok(Map.<String, Object>of("indexed", count)));
        }
        return searchService.rebuildIndex(documents)
                .thenApply(done -> ResponseEntity.ok(Map.<String, Object>of("indexed", documents.size())));
    }
}
