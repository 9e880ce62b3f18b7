package com.culture.mcp.knowledge.presentation;

import com.culture.mcp.knowledge.feed.FeedUnavailableException;
import com.culture.mcp.knowledge.index.KnowledgeIndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps index write failures and invalid arguments to JSON error bodies.
 * Search failures never get here; the searcher answers them with empty pages.
 */
@RestControllerAdvice
public class SearchExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SearchExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(FeedUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleFeedUnavailable(FeedUnavailableException e) {
        log.warn("Request cannot be served: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException e) {
        log.error("Unexpected state: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal error: " + e.getMessage()));
    }

    @ExceptionHandler(KnowledgeIndexException.class)
    public ResponseEntity<Map<String, String>> handleIndexFailure(KnowledgeIndexException e) {
        log.error("Index operation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Index operation failed: " + e.getMessage()));
    }
}
