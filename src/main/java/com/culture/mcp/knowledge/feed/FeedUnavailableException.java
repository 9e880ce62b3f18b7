package com.culture.mcp.knowledge.feed;

/** Raised when a rebuild from the repository snapshot is requested but no feed is configured. */
public class FeedUnavailableException extends RuntimeException {

    public FeedUnavailableException(String message) {
        super(message);
    }
}
