package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.domain.SearchHit;
import com.culture.mcp.knowledge.domain.SearchPage;
import com.culture.mcp.knowledge.index.IndexSchema;
import com.culture.mcp.knowledge.index.IndexStore;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes ranked, paginated searches against the committed index snapshot.
 *
 * Any failure on this path is logged, counted in the {@link SearchHealthMonitor}
 * and answered with an empty page, so callers see "no results" instead of an
 * error.
 */
public class DocumentSearcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentSearcher.class);

    private final IndexStore store;
    private final KnowledgeQueryBuilder queryBuilder;
    private final ExcerptGenerator excerpts;
    private final SearchHealthMonitor health;

    public DocumentSearcher(IndexStore store, KnowledgeQueryBuilder queryBuilder,
                            ExcerptGenerator excerpts, SearchHealthMonitor health) {
        this.store = Objects.requireNonNull(store, "store");
        this.queryBuilder = Objects.requireNonNull(queryBuilder, "queryBuilder");
        this.excerpts = Objects.requireNonNull(excerpts, "excerpts");
        this.health = Objects.requireNonNull(health, "health");
    }

    public SearchPage search(String queryText, String category, String sourceType, int limit, int offset) {
        try {
            return execute(queryText, category, sourceType, limit, Math.max(0, offset));
        } catch (IOException | RuntimeException e) {
            log.error("Search failed query={} category={} sourceType={} error={}",
                    queryText, category, sourceType, e.toString(), e);
            health.recordSearchFailure(e);
            return SearchPage.empty();
        }
    }

    private SearchPage execute(String queryText, String category, String sourceType, int limit, int offset)
            throws IOException {
        KnowledgeQueryBuilder.Built built;
        try {
            built = queryBuilder.build(queryText, category, sourceType);
        } catch (RuntimeException e) {
            throw new QueryExecutionException("Cannot build query for: " + queryText, e);
        }

        return store.withSearcher(searcher -> {
            int total = searcher.count(built.query());
            if (limit <= 0 || offset >= total) {
                return new SearchPage(List.of(), total);
            }
            int wanted = (int) Math.min((long) limit + offset, total);
            TopDocs top = searcher.search(built.query(), wanted);
            StoredFields storedFields = searcher.getIndexReader().storedFields();

            List<SearchHit> hits = new ArrayList<>(Math.max(0, top.scoreDocs.length - offset));
            for (int i = offset; i < top.scoreDocs.length; i++) {
                ScoreDoc scoreDoc = top.scoreDocs[i];
                Document doc = storedFields.document(scoreDoc.doc);
                hits.add(toHit(doc, scoreDoc.score, built.terms()));
            }
            log.debug("Search query={} total={} returned={}", queryText, total, hits.size());
            return new SearchPage(hits, total);
        });
    }

    private SearchHit toHit(Document doc, float score, List<String> terms) {
        return new SearchHit(
                doc.get(IndexSchema.ID),
                doc.get(IndexSchema.TITLE),
                doc.get(IndexSchema.FILE_PATH),
                doc.get(IndexSchema.CATEGORY),
                doc.get(IndexSchema.SOURCE_TYPE),
                doc.get(IndexSchema.AUTHOR),
                IndexSchema.parseTimestamp(doc.get(IndexSchema.UPDATED_AT)),
                score,
                excerptFor(doc, terms)
        );
    }

    private String excerptFor(Document doc, List<String> terms) {
        try {
            return excerpts.excerpt(doc.get(IndexSchema.CONTENT), doc.get(IndexSchema.TITLE), terms);
        } catch (ExcerptGenerationException e) {
            log.warn("Excerpt generation failed id={} error={}", doc.get(IndexSchema.ID), e.toString());
            health.recordExcerptFailure(e);
            return "";
        }
    }
}
