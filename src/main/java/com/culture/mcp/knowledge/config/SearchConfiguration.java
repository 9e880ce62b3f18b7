package com.culture.mcp.knowledge.config;

import com.culture.mcp.knowledge.analysis.TextTokenizer;
import com.culture.mcp.knowledge.index.IndexCorruptException;
import com.culture.mcp.knowledge.index.IndexStore;
import com.culture.mcp.knowledge.search.DocumentSearcher;
import com.culture.mcp.knowledge.search.ExcerptGenerator;
import com.culture.mcp.knowledge.search.KnowledgeQueryBuilder;
import com.culture.mcp.knowledge.search.SearchHealthMonitor;
import com.culture.mcp.knowledge.service.IndexMaintenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the single search engine instance of this process.
 */
@Configuration
@EnableConfigurationProperties(SearchProperties.class)
public class SearchConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SearchConfiguration.class);

    @Bean
    public TextTokenizer textTokenizer(SearchProperties properties) {
        return TextTokenizer.create(properties.chineseAnalyzer(), properties.minWordLength(),
                properties.customDictionary());
    }

    @Bean(destroyMethod = "close")
    public IndexStore indexStore(SearchProperties properties, TextTokenizer tokenizer) {
        try {
            return IndexStore.openOrCreate(properties.indexPath(), tokenizer.analyzer());
        } catch (IndexCorruptException e) {
            if (!properties.recreateOnCorruption()) {
                throw e;
            }
            log.warn("Search index is corrupt, recreating it empty path={} error={}",
                    properties.indexPath(), e.getMessage());
            return IndexStore.recreate(properties.indexPath(), tokenizer.analyzer());
        }
    }

    @Bean
    public KnowledgeQueryBuilder knowledgeQueryBuilder(TextTokenizer tokenizer) {
        return new KnowledgeQueryBuilder(tokenizer);
    }

    @Bean
    public ExcerptGenerator excerptGenerator(TextTokenizer tokenizer, SearchProperties properties) {
        return new ExcerptGenerator(tokenizer, properties.excerptLength());
    }

    @Bean
    public SearchHealthMonitor searchHealthMonitor() {
        return new SearchHealthMonitor();
    }

    @Bean
    public DocumentSearcher documentSearcher(IndexStore store, KnowledgeQueryBuilder queryBuilder,
                                             ExcerptGenerator excerptGenerator, SearchHealthMonitor health) {
        return new DocumentSearcher(store, queryBuilder, excerptGenerator, health);
    }

    @Bean
    public IndexMaintenance indexMaintenance(IndexStore store) {
        return new IndexMaintenance(store);
    }

    @Bean
    public ThreadPoolTaskExecutor searchExecutor(SearchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, properties.workerThreads()));
        executor.setMaxPoolSize(Math.max(1, properties.workerThreads()));
        executor.setThreadNamePrefix("search-io-");
        // let in-flight write transactions finish before the index is closed
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
