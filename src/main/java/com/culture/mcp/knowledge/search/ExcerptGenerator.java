package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.analysis.TextTokenizer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds query-centred snippets for result previews.
 *
 * The window is centred on the first occurrence of the longest query term
 * found in the content, widened to nearby sentence ends, and every query term
 * inside it is wrapped in {@code **}. Content without any term falls back to
 * a plain truncation; empty content falls back to the title.
 */
public class ExcerptGenerator {

    public static final int DEFAULT_MAX_LENGTH = 200;

    static final String HIGHLIGHT = "**";
    static final String ELLIPSIS = "...";

    private static final int SENTENCE_SEARCH_RANGE = 50;

    private final TextTokenizer tokenizer;
    private final int maxLength;

    public ExcerptGenerator(TextTokenizer tokenizer, int maxLength) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.maxLength = maxLength > 0 ? maxLength : DEFAULT_MAX_LENGTH;
    }

    /** Snippet of {@code content} for the raw user query. */
    public String excerpt(String content, String title, String queryText) {
        List<String> terms = queryText == null ? List.of() : tokenizer.terms(queryText);
        if (terms.isEmpty() && queryText != null && !queryText.isBlank()) {
            terms = List.of(queryText.strip());
        }
        return excerpt(content, title, terms, maxLength);
    }

    /** Snippet of {@code content} for already analyzed query terms. */
    public String excerpt(String content, String title, List<String> queryTerms) {
        return excerpt(content, title, queryTerms, maxLength);
    }

    public String excerpt(String content, String title, List<String> queryTerms, int maxLength) {
        try {
            if (content == null || content.isEmpty()) {
                return truncate(title == null ? "" : title, maxLength);
            }

            Set<String> terms = new LinkedHashSet<>();
            for (String term : queryTerms) {
                if (term != null && !term.isBlank()) terms.add(term);
            }

            int bestPos = -1;
            int bestScore = 0;
            for (String term : terms) {
                int pos = indexOfIgnoreCase(content, term, 0);
                if (pos >= 0 && term.length() > bestScore) {
                    bestPos = pos;
                    bestScore = term.length();
                }
            }

            if (bestPos < 0) {
                return truncate(content, maxLength);
            }

            int start = Math.max(0, bestPos - maxLength / 2);
            int end = Math.min(content.length(), bestPos + maxLength / 2);
            start = alignStart(content, start);
            end = alignEnd(content, end);

            String window = content.substring(start, end);
            StringBuilder out = new StringBuilder();
            if (start > 0) out.append(ELLIPSIS);
            out.append(highlight(window, terms).strip());
            if (end < content.length()) out.append(ELLIPSIS);
            return out.toString();
        } catch (RuntimeException e) {
            throw new ExcerptGenerationException("Excerpt generation failed", e);
        }
    }

    // Moves the start back to just after a sentence end, if one is close enough.
    private static int alignStart(String content, int start) {
        if (start == 0) return 0;
        int limit = Math.max(0, start - SENTENCE_SEARCH_RANGE);
        for (int i = start - 1; i >= limit; i--) {
            if (isSentenceEnd(content.charAt(i))) return i + 1;
        }
        return start;
    }

    // Moves the end forward to just after a sentence end, if one is close enough.
    private static int alignEnd(String content, int end) {
        if (end >= content.length()) return content.length();
        int limit = Math.min(content.length(), end + SENTENCE_SEARCH_RANGE);
        for (int i = end; i < limit; i++) {
            if (isSentenceEnd(content.charAt(i))) return i + 1;
        }
        return end;
    }

    static String highlight(String text, Set<String> terms) {
        boolean[] marked = new boolean[text.length()];
        for (String term : terms) {
            int from = 0;
            int pos;
            while ((pos = indexOfIgnoreCase(text, term, from)) >= 0) {
                for (int i = pos; i < pos + term.length(); i++) marked[i] = true;
                from = pos + term.length();
            }
        }

        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            if (marked[i] && (i == 0 || !marked[i - 1])) out.append(HIGHLIGHT);
            out.append(text.charAt(i));
            if (marked[i] && (i == text.length() - 1 || !marked[i + 1])) out.append(HIGHLIGHT);
        }
        return out.toString();
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) return text;
        String head = text.substring(0, maxLength);
        for (int i = head.length() - 1; i > maxLength / 2; i--) {
            if (isSentenceEnd(head.charAt(i))) return head.substring(0, i + 1);
        }
        return head + ELLIPSIS;
    }

    static int indexOfIgnoreCase(String text, String term, int from) {
        int last = text.length() - term.length();
        for (int i = Math.max(0, from); i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) return i;
        }
        return -1;
    }

    private static boolean isSentenceEnd(char c) {
        return c == '。' || c == '！' || c == '？' || c == '\n';
    }
}
