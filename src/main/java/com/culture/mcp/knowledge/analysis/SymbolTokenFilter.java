package com.culture.mcp.knowledge.analysis;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/** Drops tokens made only of punctuation, symbols or whitespace. */
public final class SymbolTokenFilter extends FilteringTokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);

    public SymbolTokenFilter(TokenStream in) {
        super(in);
    }

    @Override
    protected boolean accept() {
        char[] buffer = termAtt.buffer();
        for (int i = 0; i < termAtt.length(); i++) {
            if (Character.isLetterOrDigit(buffer[i])) return true;
        }
        return false;
    }
}
