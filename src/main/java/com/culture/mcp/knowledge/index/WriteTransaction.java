package com.culture.mcp.knowledge.index;

import com.culture.mcp.knowledge.domain.IndexedDocument;
import org.apache.lucene.index.IndexWriter;

import java.io.IOException;

/**
 * An exclusive write batch against an {@link IndexStore}. Changes become
 * visible to readers on {@link #commit()}; {@link #cancel()} discards them.
 * Closing a transaction that was neither committed nor cancelled cancels it,
 * so try-with-resources always releases the writer.
 */
public final class WriteTransaction implements AutoCloseable {

    private final IndexStore store;
    private final IndexWriter writer;
    private boolean finished;

    WriteTransaction(IndexStore store, IndexWriter writer) {
        this.store = store;
        this.writer = writer;
    }

    public void add(IndexedDocument document) {
        ensureOpen();
        try {
            writer.addDocument(IndexSchema.toLucene(document));
        } catch (IOException | RuntimeException e) {
            throw failed("add " + document.id(), e);
        }
    }

    /** Replaces every indexed document with the same id, or adds it when there is none. */
    public void replace(IndexedDocument document) {
        ensureOpen();
        try {
            writer.updateDocument(IndexSchema.idTerm(document.id()), IndexSchema.toLucene(document));
        } catch (IOException | RuntimeException e) {
            throw failed("replace " + document.id(), e);
        }
    }

    public void delete(String id) {
        ensureOpen();
        try {
            writer.deleteDocuments(IndexSchema.idTerm(id));
        } catch (IOException | RuntimeException e) {
            throw failed("delete " + id, e);
        }
    }

    public void commit() {
        ensureOpen();
        try {
            writer.commit();
        } catch (IOException | RuntimeException e) {
            throw failed("commit", e);
        }
        finished = true;
        store.afterCommit();
    }

    public void cancel() {
        if (finished) return;
        finished = true;
        store.afterCancel();
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() {
        cancel();
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Write transaction already finished");
        }
    }

    private WriteTransactionException failed(String operation, Exception cause) {
        cancel();
        return new WriteTransactionException("Index write failed during " + operation, cause);
    }
}
