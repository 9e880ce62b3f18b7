package com.culture.mcp.knowledge.index;

/**
 * A write batch failed. The batch has been rolled back to the last commit by
 * the time this reaches the caller.
 */
public class WriteTransactionException extends KnowledgeIndexException {

    public WriteTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
