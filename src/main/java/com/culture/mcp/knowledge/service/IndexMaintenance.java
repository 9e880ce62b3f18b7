package com.culture.mcp.knowledge.service;

import com.culture.mcp.knowledge.domain.IndexStats;
import com.culture.mcp.knowledge.domain.IndexedDocument;
import com.culture.mcp.knowledge.index.IndexSchema;
import com.culture.mcp.knowledge.index.IndexStore;
import com.culture.mcp.knowledge.index.WriteTransaction;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.util.Bits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Keeps the index in line with the document repository: single-document
 * add/update/delete, full rebuild from a snapshot, and statistics read back
 * from the index itself.
 */
public class IndexMaintenance {

    private static final Logger log = LoggerFactory.getLogger(IndexMaintenance.class);

    private static final Set<String> STATS_FIELDS = Set.of(IndexSchema.CATEGORY, IndexSchema.SOURCE_TYPE);
    private static final String UNKNOWN = "unknown";

    private final IndexStore store;

    public IndexMaintenance(IndexStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Adds a document. An already indexed document with the same id is replaced
     * so that ids stay unique.
     */
    public void add(IndexedDocument document) {
        try (WriteTransaction tx = store.beginWrite()) {
            tx.replace(document);
            tx.commit();
        } catch (RuntimeException e) {
            log.error("Failed to add document to index id={} error={}", document.id(), e.toString());
            throw e;
        }
        log.info("Document added to search index id={}", document.id());
    }

    /** Replaces the document with the same id, or adds it when it is not indexed yet. */
    public void update(IndexedDocument document) {
        try (WriteTransaction tx = store.beginWrite()) {
            tx.replace(document);
            tx.commit();
        } catch (RuntimeException e) {
            log.error("Failed to update document in index id={} error={}", document.id(), e.toString());
            throw e;
        }
        log.info("Document updated in search index id={}", document.id());
    }

    public void delete(String id) {
        try (WriteTransaction tx = store.beginWrite()) {
            tx.delete(id);
            tx.commit();
        } catch (RuntimeException e) {
            log.error("Failed to delete document from index id={} error={}", id, e.toString());
            throw e;
        }
        log.info("Document deleted from search index id={}", id);
    }

    /**
     * Discards the index and writes {@code documents} into a fresh one in a
     * single batch. When the batch fails the index is left empty and the error
     * is rethrown.
     */
    public void rebuild(List<IndexedDocument> documents) {
        try (WriteTransaction tx = store.beginRebuild()) {
            for (IndexedDocument document : documents) {
                tx.replace(document);
            }
            tx.commit();
        } catch (RuntimeException e) {
            log.error("Failed to rebuild index documents={} error={}", documents.size(), e.toString());
            throw e;
        }
        log.info("Search index rebuilt documents={}", documents.size());
    }

    /** Counts over the committed index, which may lag behind the repository. */
    public IndexStats stats() {
        try {
            return store.withSearcher(searcher -> {
                Map<String, Long> categories = new TreeMap<>();
                Map<String, Long> sources = new TreeMap<>();
                for (LeafReaderContext leaf : searcher.getIndexReader().leaves()) {
                    Bits live = leaf.reader().getLiveDocs();
                    StoredFields storedFields = leaf.reader().storedFields();
                    for (int i = 0; i < leaf.reader().maxDoc(); i++) {
                        if (live != null && !live.get(i)) continue;
                        Document doc = storedFields.document(i, STATS_FIELDS);
                        categories.merge(valueOrUnknown(doc.get(IndexSchema.CATEGORY)), 1L, Long::sum);
                        sources.merge(valueOrUnknown(doc.get(IndexSchema.SOURCE_TYPE)), 1L, Long::sum);
                    }
                }
                return new IndexStats(searcher.getIndexReader().numDocs(), categories, sources);
            });
        } catch (IOException | RuntimeException e) {
            log.error("Failed to get search stats error={}", e.toString());
            return IndexStats.empty();
        }
    }

    private static String valueOrUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
