package com.culture.mcp.knowledge.index;

/** The index directory holds data that cannot be read as an index. */
public class IndexCorruptException extends KnowledgeIndexException {

    public IndexCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
