package com.culture.mcp.knowledge.feed;

import com.culture.mcp.knowledge.service.KnowledgeSearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class IndexStartupRebuilderTest {

    private final KnowledgeSearchService searchService = mock(KnowledgeSearchService.class);

    @Test
    public void testRebuildsFromFeed() {
        when(searchService.rebuildFromFeed()).thenReturn(CompletableFuture.completedFuture(3));

        new IndexStartupRebuilder(searchService, feed(List::of)).run(null);

        verify(searchService).rebuildFromFeed();
    }

    @Test
    public void testSkipsWithoutFeed() {
        new IndexStartupRebuilder(searchService, feed(null)).run(null);

        verify(searchService, never()).rebuildFromFeed();
    }

    @Test
    public void testFailedRebuildDoesNotStopStartup() {
        when(searchService.rebuildFromFeed())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("repository offline")));

        assertDoesNotThrow(() -> new IndexStartupRebuilder(searchService, feed(List::of)).run(null));
    }

    private static ObjectProvider<PublishedDocumentFeed> feed(PublishedDocumentFeed feed) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        if (feed != null) {
            beanFactory.addBean("feed", feed);
        }
        return beanFactory.getBeanProvider(PublishedDocumentFeed.class);
    }
}
