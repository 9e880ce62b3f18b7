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
 * Joins runs of adjacent tokens that spell a {@link UserDictionary} entry and
 * emits the joined word at the position of the first token of the run. The
 * original tokens are kept, so both the pieces and the compound are searchable.
 */
public final class UserDictionaryFilter extends TokenFilter {

    private final UserDictionary dictionary;
    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAtt = addAttribute(OffsetAttribute.class);
    private final PositionIncrementAttribute posIncAtt = addAttribute(PositionIncrementAttribute.class);

    private final Deque<Buffered> window = new ArrayDeque<>();
    private final Deque<Buffered> joined = new ArrayDeque<>();
    private boolean exhausted;

    private record Buffered(State state, String term, int start, int end) {}

    public UserDictionaryFilter(TokenStream input, UserDictionary dictionary) {
        super(input);
        this.dictionary = dictionary;
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!joined.isEmpty()) {
            Buffered word = joined.poll();
            restoreState(word.state());
            termAtt.setEmpty().append(word.term());
            offsetAtt.setOffset(word.start(), word.end());
            posIncAtt.setPositionIncrement(0);
            return true;
        }
        fillWindow();
        if (window.isEmpty()) return false;

        Buffered head = window.poll();
        collectJoinedWords(head);
        restoreState(head.state());
        return true;
    }

    // Reads ahead until the window covers the longest dictionary entry starting at its head.
    private void fillWindow() throws IOException {
        while (!exhausted && (window.isEmpty()
                || window.peekLast().end() - window.peekFirst().start() < dictionary.maxWordLength())) {
            if (input.incrementToken()) {
                window.add(new Buffered(captureState(), termAtt.toString(),
                        offsetAtt.startOffset(), offsetAtt.endOffset()));
            } else {
                exhausted = true;
            }
        }
    }

    private void collectJoinedWords(Buffered head) {
        StringBuilder word = new StringBuilder(head.term());
        int previousEnd = head.end();
        for (Buffered next : window) {
            if (next.start() != previousEnd) break;
            word.append(next.term());
            if (word.length() > dictionary.maxWordLength()) break;
            if (dictionary.contains(word)) {
                joined.add(new Buffered(head.state(), word.toString(), head.start(), next.end()));
            }
            previousEnd = next.end();
        }
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        window.clear();
        joined.clear();
        exhausted = false;
    }
}
