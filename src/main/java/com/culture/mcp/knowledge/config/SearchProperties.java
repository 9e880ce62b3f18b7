package com.culture.mcp.knowledge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Search engine settings, bound from {@code knowledge.search.*}.
 *
 * @param indexPath            directory holding the Lucene index
 * @param chineseAnalyzer      Chinese segmentation when true, plain Latin tokenization otherwise
 * @param minWordLength        shorter terms are dropped at index and query time
 * @param customDictionary     optional user dictionary for the Chinese segmenter
 * @param excerptLength        target snippet length in characters
 * @param rebuildOnStartup     rebuild from the published document feed when the service starts
 * @param recreateOnCorruption replace an unreadable index with an empty one instead of failing startup
 * @param workerThreads        size of the pool that runs blocking index I/O
 */
@ConfigurationProperties(prefix = "knowledge.search")
public record SearchProperties(
        @DefaultValue("data/search_index") Path indexPath,
        @DefaultValue("true") boolean chineseAnalyzer,
        @DefaultValue("1") int minWordLength,
        Path customDictionary,
        @DefaultValue("200") int excerptLength,
        @DefaultValue("false") boolean rebuildOnStartup,
        @DefaultValue("false") boolean recreateOnCorruption,
        @DefaultValue("4") int workerThreads
) {}
