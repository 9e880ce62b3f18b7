package com.culture.mcp.knowledge.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw text into (term, start, end) tuples using the same analyzer the
 * index is written with.
 */
public class TextTokenizer {

    private static final String FIELD = "text";

    private final Analyzer analyzer;

    public TextTokenizer(Analyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public static TextTokenizer create(boolean chinese, int minWordLength, Path customDictionary) {
        return new TextTokenizer(new KnowledgeAnalyzer(chinese, minWordLength, UserDictionary.forPath(customDictionary)));
    }

    public Analyzer analyzer() {
        return analyzer;
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) return tokens;

        try (TokenStream ts = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = ts.addAttribute(OffsetAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                tokens.add(new Token(term.toString(), offset.startOffset(), offset.endOffset()));
            }
            ts.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }

    /** Distinct terms of {@code text} in first-seen order. */
    public List<String> terms(String text) {
        LinkedHashSet<String> terms = new LinkedHashSet<>();
        for (Token token : tokenize(text)) {
            terms.add(token.term());
        }
        return new ArrayList<>(terms);
    }
}
