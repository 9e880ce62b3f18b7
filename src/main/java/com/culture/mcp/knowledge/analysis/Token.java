package com.culture.mcp.knowledge.analysis;

/** One segmented term with its character offsets in the source text. */
public record Token(String term, int start, int end) {}
