package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.index.KnowledgeIndexException;

public class ExcerptGenerationException extends KnowledgeIndexException {

    public ExcerptGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
