package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.index.KnowledgeIndexException;

public class QueryExecutionException extends KnowledgeIndexException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
