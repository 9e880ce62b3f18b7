package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.analysis.KnowledgeAnalyzer;
import com.culture.mcp.knowledge.analysis.TextTokenizer;
import com.culture.mcp.knowledge.analysis.UserDictionary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExcerptGeneratorTest {

    private static final int MAX = 200;

    private final ExcerptGenerator generator = new ExcerptGenerator(
            new TextTokenizer(new KnowledgeAnalyzer(true, 1, UserDictionary.empty())), MAX);

    @Test
    public void testHighlightsQueryTerm() {
        String excerpt = generator.excerpt("the API reference explains usage", "Reference", "API");

        assertEquals("the **API** reference explains usage", excerpt);
        assertTrue(excerpt.length() <= MAX + 2 * ExcerptGenerator.HIGHLIGHT.length() + 2 * ExcerptGenerator.ELLIPSIS.length());
    }

    @Test
    public void testEmptyContentFallsBackToTitle() {
        assertEquals("部署指南", generator.excerpt("", "部署指南", "部署"));
        assertEquals("部署指南", generator.excerpt(null, "部署指南", "部署"));
    }

    @Test
    public void testWindowAlignsToSentenceEnds() {
        String content = "甲".repeat(20) + "。" + "乙".repeat(110) + "关键词" + "丙".repeat(110) + "！" + "丁".repeat(100);

        String excerpt = generator.excerpt(content, "", List.of("关键词"), MAX);

        assertEquals("..." + "乙".repeat(110) + "**关键词**" + "丙".repeat(110) + "！" + "...", excerpt);
    }

    @Test
    public void testWindowWithoutNearbySentenceEnd() {
        String content = "a".repeat(300) + "needle" + "b".repeat(300);

        String excerpt = generator.excerpt(content, "", List.of("needle"), MAX);

        assertEquals("..." + "a".repeat(100) + "**needle**" + "b".repeat(94) + "...", excerpt);
    }

    @Test
    public void testLongestTermPicksTheWindow() {
        String content = "x" + "c".repeat(400) + "部署指南" + "d".repeat(50);

        String excerpt = generator.excerpt(content, "", List.of("x", "部署指南"), MAX);

        assertTrue(excerpt.contains("**部署指南**"), excerpt);
        assertTrue(excerpt.startsWith("..."), excerpt);
        assertTrue(!excerpt.endsWith("..."), excerpt);
    }

    @Test
    public void testOverlappingTermsMergeIntoOneHighlight() {
        String excerpt = generator.excerpt("API文档说明", "", List.of("api", "api文档"), MAX);

        assertEquals("**API文档**说明", excerpt);
    }

    @Test
    public void testEveryOccurrenceIsHighlighted() {
        String excerpt = generator.excerpt("Docker和Kubernetes, docker compose", "", List.of("docker"), MAX);

        assertEquals("**Docker**和Kubernetes, **docker** compose", excerpt);
    }

    @Test
    public void testNoMatchReturnsShortContentUnchanged() {
        assertEquals("代码审查流程", generator.excerpt("代码审查流程", "", List.of("部署"), MAX));
    }

    @Test
    public void testNoMatchCutsAtSentenceEndPastMidpoint() {
        String content = "甲".repeat(150) + "。" + "乙".repeat(200);

        assertEquals("甲".repeat(150) + "。", generator.excerpt(content, "", List.of("部署"), MAX));
    }

    @Test
    public void testNoMatchTruncatesWithEllipsis() {
        String content = "甲".repeat(50) + "。" + "乙".repeat(300);

        assertEquals(content.substring(0, MAX) + "...", generator.excerpt(content, "", List.of("部署"), MAX));
    }
}
