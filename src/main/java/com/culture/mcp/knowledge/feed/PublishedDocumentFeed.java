package com.culture.mcp.knowledge.feed;

import com.culture.mcp.knowledge.domain.IndexedDocument;

import java.util.List;

/**
 * Snapshot of every published document held by the document repository.
 * Implemented by the storage layer; feeds full index rebuilds.
 */
@FunctionalInterface
public interface PublishedDocumentFeed {

    List<IndexedDocument> listPublishedDocuments();
}
