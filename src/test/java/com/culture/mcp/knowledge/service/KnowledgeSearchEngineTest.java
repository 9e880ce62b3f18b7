package com.culture.mcp.knowledge.service;

import com.culture.mcp.knowledge.analysis.TextTokenizer;
import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.IndexedDocument;
import com.culture.mcp.knowledge.domain.SearchHit;
import com.culture.mcp.knowledge.domain.SearchPage;
import com.culture.mcp.knowledge.index.IndexStore;
import com.culture.mcp.knowledge.index.WriteTransactionException;
import com.culture.mcp.knowledge.search.DocumentSearcher;
import com.culture.mcp.knowledge.search.ExcerptGenerator;
import com.culture.mcp.knowledge.search.KnowledgeQueryBuilder;
import com.culture.mcp.knowledge.search.SearchHealthMonitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Indexing and searching end to end against a real on-disk index.
 */
public class KnowledgeSearchEngineTest {

    @TempDir
    Path tempDir;

    private IndexStore store;
    private IndexMaintenance maintenance;
    private DocumentSearcher searcher;
    private SearchHealthMonitor health;

    @BeforeEach
    public void setUp() {
        TextTokenizer tokenizer = TextTokenizer.create(true, 1, null);
        store = IndexStore.openOrCreate(tempDir.resolve("index"), tokenizer.analyzer());
        health = new SearchHealthMonitor();
        maintenance = new IndexMaintenance(store);
        searcher = new DocumentSearcher(store, new KnowledgeQueryBuilder(tokenizer),
                new ExcerptGenerator(tokenizer, 200), health);
    }

    @AfterEach
    public void tearDown() throws IOException {
        store.close();
    }

    @Test
    public void testAddedDocumentIsSearchable() {
        maintenance.add(doc("1", "Kafka operations", "Consumer lag troubleshooting notes", "ops", "local"));

        SearchPage page = searcher.search("kafka", null, null, 10, 0);

        assertEquals(1, page.total());
        SearchHit hit = page.hits().get(0);
        assertEquals("1", hit.id());
        assertEquals("Kafka operations", hit.title());
        assertEquals("docs/1.md", hit.filePath());
        assertEquals("ops", hit.category());
        assertEquals("local", hit.sourceType());
        assertEquals("tester", hit.author());
        assertEquals(Instant.parse("2024-03-01T08:30:00Z"), hit.updatedAt());
        assertTrue(hit.score() > 0);
    }

    @Test
    public void testUpdateIsIdempotent() {
        IndexedDocument document = doc("1", "Runbook", "restart the broker", "ops", "local");

        maintenance.update(document);
        maintenance.update(document);
        maintenance.add(document);

        assertEquals(1, searcher.search("runbook", null, null, 10, 0).total());
        assertEquals(1, maintenance.stats().totalDocuments());
    }

    @Test
    public void testUpdateReplacesContent() {
        maintenance.add(doc("1", "Runbook", "restart the broker", "ops", "local"));
        maintenance.update(doc("1", "Runbook", "rotate the certificates", "ops", "local"));

        assertEquals(0, searcher.search("broker", null, null, 10, 0).total());
        assertEquals(1, searcher.search("certificates", null, null, 10, 0).total());
    }

    @Test
    public void testTitleMatchOutranksContentMatch() {
        maintenance.add(doc("A", "kafka streaming", "other notes", "ops", "local"));
        maintenance.add(doc("B", "other notes", "kafka streaming", "ops", "local"));

        List<SearchHit> hits = searcher.search("kafka", null, null, 10, 0).hits();

        assertEquals(2, hits.size());
        assertEquals("A", hits.get(0).id());
        assertEquals("B", hits.get(1).id());
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    public void testFiltersAreExact() {
        maintenance.add(doc("1", "backup guide", "nightly backup", "ops", "gitlab"));
        maintenance.add(doc("2", "backup guide", "weekly backup", "ops", "wiki"));
        maintenance.add(doc("3", "backup guide", "monthly backup", "Ops", "gitlab"));

        assertEquals(3, searcher.search("backup", null, null, 10, 0).total());
        assertEquals(2, searcher.search("backup", "ops", null, 10, 0).total());
        assertEquals(1, searcher.search("backup", "ops", "gitlab", 10, 0).total());
        assertEquals("1", searcher.search("backup", "ops", "gitlab", 10, 0).hits().get(0).id());
        assertEquals(0, searcher.search("backup", "op", null, 10, 0).total());
    }

    @Test
    public void testPagesAreDisjointAndCoverAllMatches() {
        for (int i = 0; i < 5; i++) {
            maintenance.add(doc("g" + i, "guide " + i, "setup guide", "docs", "local"));
        }

        Set<String> seen = new HashSet<>();
        List<String> ordered = new ArrayList<>();
        for (int offset = 0; offset < 6; offset += 2) {
            SearchPage page = searcher.search("guide", null, null, 2, offset);
            assertEquals(5, page.total());
            for (SearchHit hit : page.hits()) {
                assertTrue(seen.add(hit.id()), "Duplicate hit across pages: " + hit.id());
                ordered.add(hit.id());
            }
        }

        assertEquals(5, ordered.size());
        List<String> unpaged = searcher.search("guide", null, null, 10, 0).hits().stream().map(SearchHit::id).toList();
        assertEquals(unpaged, ordered);
    }

    @Test
    public void testOffsetPastEndKeepsTotal() {
        maintenance.add(doc("1", "guide", "setup", "docs", "local"));

        SearchPage page = searcher.search("guide", null, null, 10, 5);

        assertTrue(page.hits().isEmpty());
        assertEquals(1, page.total());
    }

    @Test
    public void testRebuildReplacesWholeIndex() {
        maintenance.add(doc("old", "legacy page", "legacy content", "docs", "local"));

        maintenance.rebuild(List.of(
                doc("n1", "fresh page", "fresh content", "docs", "local"),
                doc("n2", "another page", "more content", "ops", "wiki")));

        assertEquals(0, searcher.search("legacy", null, null, 10, 0).total());
        assertEquals(1, searcher.search("fresh", null, null, 10, 0).total());
        assertEquals(2, maintenance.stats().totalDocuments());
    }

    @Test
    public void testFailedRebuildLeavesEmptyIndex() {
        maintenance.add(doc("old", "legacy page", "legacy content", "docs", "local"));

        List<IndexedDocument> batch = List.of(
                doc("n1", "fresh page", "fresh content", "docs", "local"),
                doc(null, "broken", "no id", "docs", "local"));
        assertThrows(WriteTransactionException.class, () -> maintenance.rebuild(batch));

        assertEquals(0, maintenance.stats().totalDocuments());
        maintenance.add(doc("after", "recovered", "writes still work", "docs", "local"));
        assertEquals(1, searcher.search("recovered", null, null, 10, 0).total());
    }

    @Test
    public void testDeleteRemovesDocument() {
        maintenance.add(doc("1", "temporary", "to be removed", "docs", "local"));
        maintenance.delete("1");
        maintenance.delete("missing");

        assertEquals(0, searcher.search("temporary", null, null, 10, 0).total());
        assertEquals(0, maintenance.stats().totalDocuments());
    }

    @Test
    public void testHitsCarryHighlightedExcerpts() {
        maintenance.add(doc("1", "API文档", "这是一份API接口文档，说明调用方式。", "development", "local"));

        SearchHit hit = searcher.search("api", null, null, 10, 0).hits().get(0);

        assertNotNull(hit.excerpt());
        assertTrue(hit.excerpt().contains("**API**"), hit.excerpt());
    }

    @Test
    public void testChineseDocumentsWithCategoryFilter() {
        maintenance.rebuild(List.of(
                doc("1", "API文档", "这是一份API接口文档，说明调用方式。", "development", "local"),
                doc("2", "部署指南", "Kubernetes集群部署步骤。", "deployment", "local"),
                doc("3", "开发规范", "代码提交与评审规范。", "development", "local")));

        SearchPage all = searcher.search("部署", null, null, 10, 0);
        assertTrue(all.total() >= 1);
        assertEquals("2", all.hits().get(0).id());

        SearchPage deployment = searcher.search("部署", "deployment", null, 10, 0);
        assertEquals(1, deployment.total());
        assertEquals("部署指南", deployment.hits().get(0).title());

        SearchPage development = searcher.search("部署", "development", null, 10, 0);
        assertTrue(development.hits().stream().allMatch(hit -> "development".equals(hit.category())));
    }

    @Test
    public void testApiDocsDeploymentGuideAndReviewRules() {
        maintenance.rebuild(List.of(
                doc("1", "API文档", "RESTful API设计", "development", "local"),
                doc("2", "部署指南", "Docker和Kubernetes", "deployment", "local"),
                doc("3", "开发规范", "代码审查", "development", "local")));

        SearchPage api = searcher.search("API", null, null, 10, 0);
        assertEquals(1, api.total());
        assertEquals(List.of("1"), api.hits().stream().map(SearchHit::id).toList());

        SearchPage guide = searcher.search("指南", "deployment", null, 10, 0);
        assertEquals(1, guide.total());
        assertEquals(List.of("2"), guide.hits().stream().map(SearchHit::id).toList());

        assertEquals(0, searcher.search("指南", "development", null, 10, 0).total());
    }

    @Test
    public void testCategoryFilterFollowsReindexedCategory() {
        maintenance.add(doc("2", "部署指南", "Docker和Kubernetes", "development", "local"));
        assertEquals(0, searcher.search("指南", "deployment", null, 10, 0).total());

        maintenance.update(doc("2", "部署指南", "Docker和Kubernetes", "deployment", "local"));
        assertEquals(1, searcher.search("指南", "deployment", null, 10, 0).total());
    }

    @Test
    public void testStatsCountByCategoryAndSource() {
        maintenance.add(doc("1", "a", "x", "ops", "gitlab"));
        maintenance.add(doc("2", "b", "y", "ops", "wiki"));
        maintenance.add(doc("3", "c", "z", "", "wiki"));

        IndexStats stats = maintenance.stats();

        assertEquals(3, stats.totalDocuments());
        assertEquals(Map.of("ops", 2L, "unknown", 1L), stats.categories());
        assertEquals(Map.of("gitlab", 1L, "wiki", 2L), stats.sources());
    }

    @Test
    public void testSearchFailureYieldsEmptyPageAndIsCounted() throws IOException {
        maintenance.add(doc("1", "guide", "setup", "docs", "local"));
        store.close();

        SearchPage page = searcher.search("guide", null, null, 10, 0);

        assertTrue(page.hits().isEmpty());
        assertEquals(0, page.total());
        assertEquals(1, health.snapshot(store.isAvailable()).failedSearches());
        assertNotNull(health.snapshot(false).lastFailureMessage());
        assertEquals(IndexStats.empty(), maintenance.stats());
    }

    private static IndexedDocument doc(String id, String title, String content, String category, String sourceType) {
        Instant created = Instant.parse("2024-01-15T10:00:00Z");
        Instant updated = Instant.parse("2024-03-01T08:30:00Z");
        return new IndexedDocument(id, title, content, category, sourceType, "tester",
                "docs/" + id + ".md", created, updated);
    }
}
