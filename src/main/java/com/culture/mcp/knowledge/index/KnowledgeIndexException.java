package com.culture.mcp.knowledge.index;

/**
 * Root of the failures raised by the search index.
 */
public class KnowledgeIndexException extends RuntimeException {

    public KnowledgeIndexException(String message) {
        super(message);
    }

    public KnowledgeIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
