package com.culture.mcp.knowledge.search;

import com.culture.mcp.knowledge.analysis.TextTokenizer;
import com.culture.mcp.knowledge.index.IndexSchema;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds tolerant Lucene queries from free-form user text:
 *  - per term: exact Term, *term* Wildcard and (length >= 2) Fuzzy with one edit
 *  - per field: the union of all term variants
 *  - title union boosted over the content union
 *  - category / source type as exact, non-scoring filters
 *
 * Usage:
 *   KnowledgeQueryBuilder qb = new KnowledgeQueryBuilder(tokenizer);
 *   KnowledgeQueryBuilder.Built built = qb.build("部署 docker", "deployment", null);
 *   searcher.search(built.query(), 20);
 */
public final class KnowledgeQueryBuilder {

    public static final float TITLE_BOOST = 2.0f;

    // Tunables
    private static final int MAX_TERMS = 16;
    private static final int FUZZY_MAX_EDITS = 1;
    private static final int FUZZY_PREFIX_LENGTH = 0;
    private static final int FUZZY_MAX_EXPANSIONS = 10;

    /** The query plus the terms it was built from, which excerpts are centred on. */
    public record Built(Query query, List<String> terms) {}

    private final TextTokenizer tokenizer;

    public KnowledgeQueryBuilder(TextTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    public Built build(String queryText, String category, String sourceType) {
        String raw = queryText == null ? "" : queryText.strip();
        List<String> terms = queryTerms(raw);

        Query title = fieldUnion(IndexSchema.TITLE, terms);
        Query content = fieldUnion(IndexSchema.CONTENT, terms);

        Query text;
        if (title != null && content != null) {
            text = new BooleanQuery.Builder()
                    .add(new BoostQuery(title, TITLE_BOOST), BooleanClause.Occur.SHOULD)
                    .add(content, BooleanClause.Occur.SHOULD)
                    .build();
        } else if (title != null) {
            text = title;
        } else if (content != null) {
            text = content;
        } else {
            // never fall through to match-all
            text = new TermQuery(new Term(IndexSchema.TITLE, raw));
        }

        if (isBlank(category) && isBlank(sourceType)) {
            return new Built(text, terms);
        }

        BooleanQuery.Builder root = new BooleanQuery.Builder();
        root.add(text, BooleanClause.Occur.MUST);
        if (!isBlank(category)) {
            root.add(new TermQuery(new Term(IndexSchema.CATEGORY, category)), BooleanClause.Occur.FILTER);
        }
        if (!isBlank(sourceType)) {
            root.add(new TermQuery(new Term(IndexSchema.SOURCE_TYPE, sourceType)), BooleanClause.Occur.FILTER);
        }
        return new Built(root.build(), terms);
    }

    /**
     * Analyzed terms of {@code raw}; when analysis yields nothing (e.g. only
     * punctuation) the whole string becomes the single term.
     */
    List<String> queryTerms(String raw) {
        if (raw.isEmpty()) return List.of();
        List<String> terms = tokenizer.terms(raw);
        if (terms.isEmpty()) {
            return List.of(raw.toLowerCase(Locale.ROOT));
        }
        return terms.size() > MAX_TERMS ? List.copyOf(terms.subList(0, MAX_TERMS)) : terms;
    }

    private Query fieldUnion(String field, List<String> terms) {
        if (terms.isEmpty()) return null;
        BooleanQuery.Builder union = new BooleanQuery.Builder();
        for (String term : terms) {
            union.add(termVariants(field, term), BooleanClause.Occur.SHOULD);
        }
        return union.build();
    }

    private Query termVariants(String field, String term) {
        List<Query> variants = new ArrayList<>(3);
        variants.add(new TermQuery(new Term(field, term)));
        variants.add(new WildcardQuery(new Term(field, "*" + escapeWildcard(term) + "*")));
        if (term.codePointCount(0, term.length()) >= 2) {
            variants.add(new FuzzyQuery(new Term(field, term),
                    FUZZY_MAX_EDITS, FUZZY_PREFIX_LENGTH, FUZZY_MAX_EXPANSIONS, true));
        }
        BooleanQuery.Builder any = new BooleanQuery.Builder();
        for (Query q : variants) {
            any.add(q, BooleanClause.Occur.SHOULD);
        }
        return any.build();
    }

    static String escapeWildcard(String term) {
        StringBuilder out = new StringBuilder(term.length());
        for (int i = 0; i < term.length(); i++) {
            char c = term.charAt(i);
            if (c == WildcardQuery.WILDCARD_STRING || c == WildcardQuery.WILDCARD_CHAR || c == WildcardQuery.WILDCARD_ESCAPE) {
                out.append(WildcardQuery.WILDCARD_ESCAPE);
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
