package com.culture.mcp.knowledge.analysis;

import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Recall-oriented segmentation: after every Han word of three or more
 * characters, also emits its overlapping two- and three-character sub-words at
 * the same position, so that a query for "索引" finds a document segmented as
 * "全文索引".
 */
public final class SearchModeFilter extends TokenFilter {

    private static final int MIN_EXPANDED_LENGTH = 3;
    private static final int MAX_SUB_WORD_LENGTH = 3;

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);

    private final Deque<Token> pending = new ArrayDeque<>();
    private State current;

    public SearchModeFilter(TokenStream input) {
        super(input);
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!pending.isEmpty()) {
            Token sub = pending.poll();
            restoreState(current);
            termAtt.setEmpty().append(sub.term());
            offsetAtt.setOffset(sub.start(), sub.end());
            posIncAtt.setPositionIncrement(0);
            return true;
        }
        if (!input.incrementToken()) return false;

        String term = termAtt.toString();
        int start = offsetAtt.startOffset();
        if (term.length() >= MIN_EXPANDED_LENGTH
                && offsetAtt.endOffset() - start == term.length()
                && isHan(term)) {
            for (int n = 2; n <= MAX_SUB_WORD_LENGTH && n < term.length(); n++) {
                for (int i = 0; i + n <= term.length(); i++) {
                    pending.add(new Token(term.substring(i, i + n), start + i, start + i + n));
                }
            }
            current = captureState();
        }
        return true;
    }

    private static boolean isHan(String term) {
        for (int i = 0; i < term.length(); i++) {
            char c = term.charAt(i);
            if (Character.isSurrogate(c) || Character.UnicodeScript.of(c) != Character.UnicodeScript.HAN) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        pending.clear();
        current = null;
    }
}
