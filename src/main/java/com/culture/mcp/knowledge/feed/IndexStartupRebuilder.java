package com.culture.mcp.knowledge.feed;

import com.culture.mcp.knowledge.service.KnowledgeSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the index from the repository snapshot once the application has
 * started. A failed rebuild is logged; the service keeps running and the
 * rebuild can be retried through the API.
 */
@Component
@ConditionalOnProperty(prefix = "knowledge.search", name = "rebuild-on-startup", havingValue = "true")
public class IndexStartupRebuilder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexStartupRebuilder.class);

    private final KnowledgeSearchService searchService;
    private final ObjectProvider<PublishedDocumentFeed> feed;

    public IndexStartupRebuilder(KnowledgeSearchService searchService, ObjectProvider<PublishedDocumentFeed> feed) {
        this.searchService = searchService;
        this.feed = feed;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (feed.getIfAvailable() == null) {
            log.warn("Startup rebuild requested but no published document feed is configured");
            return;
        }
        try {
            int count = searchService.rebuildFromFeed().join();
            log.info("Startup index rebuild finished documents={}", count);
        } catch (RuntimeException e) {
            log.error("Startup index rebuild failed error={}", e.toString(), e);
        }
    }
}
