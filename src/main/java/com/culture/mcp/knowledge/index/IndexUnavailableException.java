package com.culture.mcp.knowledge.index;

/** Raised to readers while the index is closed or being recreated. */
public class IndexUnavailableException extends KnowledgeIndexException {

    public IndexUnavailableException(String message) {
        super(message);
    }
}
