package com.culture.mcp.knowledge.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexWriterConfig.OpenMode;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * On-disk Lucene index with a single serialized writer and snapshot readers.
 *
 * Writes go through {@link WriteTransaction}s, one at a time. Readers use a
 * {@link SearcherManager} opened on the directory, so they only ever see
 * committed state and are refreshed after each commit.
 */
public class IndexStore implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

    private final Path path;
    private final Analyzer analyzer;
    private final ReentrantLock writeLock = new ReentrantLock();

    // guarded by writeLock
    private Directory directory;
    private IndexWriter writer;
    private boolean closed;

    private volatile SearcherManager searcherManager;

    @FunctionalInterface
    public interface SearcherCallback<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }

    private IndexStore(Path path, Analyzer analyzer) {
        this.path = Objects.requireNonNull(path, "path");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    /**
     * Opens the index at {@code path}, or creates an empty one when no index exists there.
     * @throws IndexCorruptException if a commit point exists but cannot be read.
     */
    public static IndexStore openOrCreate(Path path, Analyzer analyzer) {
        IndexStore store = new IndexStore(path, analyzer);
        try {
            store.open(false);
        } catch (IOException e) {
            throw new KnowledgeIndexException("Cannot open index at " + path, e);
        }
        log.info("Search index opened path={}", path);
        return store;
    }

    /** Deletes whatever is stored at {@code path} and creates an empty index there. */
    public static IndexStore recreate(Path path, Analyzer analyzer) {
        IndexStore store = new IndexStore(path, analyzer);
        try {
            store.open(true);
        } catch (IOException e) {
            throw new KnowledgeIndexException("Cannot recreate index at " + path, e);
        }
        log.info("Search index recreated path={}", path);
        return store;
    }

    private void open(boolean fresh) throws IOException {
        if (fresh && Files.exists(path)) {
            IOUtils.rm(path);
        }
        Files.createDirectories(path);
        Directory dir = FSDirectory.open(path);
        IndexWriter w = null;
        try {
            boolean exists = DirectoryReader.indexExists(dir);
            if (exists) {
                verifyReadable(dir);
            }
            w = new IndexWriter(dir, writerConfig(exists ? OpenMode.APPEND : OpenMode.CREATE));
            if (!exists) {
                // readers need a commit point to open against
                w.commit();
            }
            this.directory = dir;
            this.writer = w;
            this.searcherManager = new SearcherManager(dir, null);
        } catch (IOException | RuntimeException e) {
            IOUtils.closeWhileHandlingException(w, dir);
            throw e;
        }
    }

    private void verifyReadable(Directory dir) {
        try (DirectoryReader ignored = DirectoryReader.open(dir)) {
            // opening the latest commit is enough to validate segment metadata
        } catch (IOException e) {
            throw new IndexCorruptException("Index at " + path + " is unreadable", e);
        }
    }

    private IndexWriterConfig writerConfig(OpenMode mode) {
        IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(mode);
        return config;
    }

    /**
     * Acquires the writer. Blocks while another thread holds a transaction.
     * @throws IllegalStateException if the calling thread already holds one.
     */
    public WriteTransaction beginWrite() {
        lockWriter();
        try {
            ensureWritable();
            return new WriteTransaction(this, writer);
        } catch (RuntimeException e) {
            writeLock.unlock();
            throw e;
        }
    }

    /**
     * Acquires the writer, discards the current index including its files and
     * returns a transaction on a fresh empty index. Readers get
     * {@link IndexUnavailableException} until the new index is open.
     */
    public WriteTransaction beginRebuild() {
        lockWriter();
        try {
            if (closed) throw new IndexUnavailableException("Index is closed: " + path);
            discard();
            open(true);
            log.info("Search index discarded for rebuild path={}", path);
            return new WriteTransaction(this, writer);
        } catch (IOException e) {
            writeLock.unlock();
            throw new WriteTransactionException("Cannot recreate index at " + path, e);
        } catch (RuntimeException e) {
            writeLock.unlock();
            throw e;
        }
    }

    // The lock is reentrant; a nested transaction would share the writer and commit the outer one's changes.
    private void lockWriter() {
        if (writeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Write transaction already open on this thread: " + path);
        }
        writeLock.lock();
    }

    void afterCommit() {
        try {
            SearcherManager manager = searcherManager;
            if (manager != null) {
                manager.maybeRefreshBlocking();
            }
        } catch (IOException e) {
            // the commit is durable; the next refresh picks it up
            log.warn("Searcher refresh after commit failed path={} error={}", path, e.getMessage());
        } finally {
            writeLock.unlock();
        }
    }

    void afterCancel() {
        try {
            if (writer != null) {
                writer.rollback();
            }
            writer = new IndexWriter(directory, writerConfig(OpenMode.APPEND));
        } catch (IOException | RuntimeException e) {
            writer = null;
            log.error("Reopening index writer after rollback failed path={}", path, e);
        } finally {
            writeLock.unlock();
        }
    }

    /** Runs {@code callback} against the latest committed snapshot. */
    public <T> T withSearcher(SearcherCallback<T> callback) throws IOException {
        SearcherManager manager = searcherManager;
        if (manager == null) {
            throw new IndexUnavailableException("Index is not open: " + path);
        }
        IndexSearcher searcher;
        try {
            searcher = manager.acquire();
        } catch (AlreadyClosedException e) {
            throw new IndexUnavailableException("Index is being replaced: " + path);
        }
        try {
            return callback.apply(searcher);
        } finally {
            manager.release(searcher);
        }
    }

    public boolean isAvailable() {
        return searcherManager != null;
    }

    private void ensureWritable() {
        if (closed || writer == null) {
            throw new IndexUnavailableException("Index writer is not open: " + path);
        }
    }

    private void discard() throws IOException {
        SearcherManager manager = searcherManager;
        searcherManager = null;
        IndexWriter w = writer;
        writer = null;
        try {
            if (w != null) w.rollback();
        } finally {
            IOUtils.close(manager, directory);
            directory = null;
        }
    }

    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            SearcherManager manager = searcherManager;
            searcherManager = null;
            IOUtils.close(manager, writer, directory);
            writer = null;
            directory = null;
            log.info("Search index closed path={}", path);
        } finally {
            writeLock.unlock();
        }
    }
}
