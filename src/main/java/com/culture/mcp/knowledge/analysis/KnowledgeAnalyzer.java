package com.culture.mcp.knowledge.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.cn.smart.HMMChineseTokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer shared by indexing, query building and excerpt generation.
 *
 * Chinese mode: HMM segmentation → lowercase → drop punctuation → user
 * dictionary compounds → search-mode sub-words → minimum length.
 * Latin mode: standard tokenizer → lowercase → minimum length.
 */
public final class KnowledgeAnalyzer extends Analyzer {

    private final boolean chinese;
    private final int minWordLength;
    private final UserDictionary dictionary;

    public KnowledgeAnalyzer(boolean chinese, int minWordLength, UserDictionary dictionary) {
        this.chinese = chinese;
        this.minWordLength = Math.max(1, minWordLength);
        this.dictionary = dictionary == null ? UserDictionary.empty() : dictionary;
    }

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        Tokenizer source = chinese ? new HMMChineseTokenizer() : new StandardTokenizer();
        TokenStream ts = new LowerCaseFilter(source);
        if (chinese) {
            ts = new SymbolTokenFilter(ts);
            if (!dictionary.isEmpty()) {
                ts = new UserDictionaryFilter(ts, dictionary);
            }
            ts = new SearchModeFilter(ts);
        }
        ts = new LengthFilter(ts, minWordLength, Integer.MAX_VALUE);
        return new TokenStreamComponents(source, ts);
    }

    @Override
    protected TokenStream normalize(String fieldName, TokenStream in) {
        return new LowerCaseFilter(in);
    }
}
