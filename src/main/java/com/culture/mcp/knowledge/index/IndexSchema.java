package com.culture.mcp.knowledge.index;

import com.culture.mcp.knowledge.domain.IndexedDocument;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field.Store;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.Term;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Field layout of the search index and the mapping between
 * {@link IndexedDocument} and Lucene documents.
 */
public final class IndexSchema {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String CATEGORY = "category";
    public static final String SOURCE_TYPE = "source_type";
    public static final String AUTHOR = "author";
    public static final String FILE_PATH = "file_path";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    // Fixed width so that stored timestamps sort lexically.
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private IndexSchema() {
    }

    public static Term idTerm(String id) {
        return new Term(ID, id);
    }

    public static Document toLucene(IndexedDocument document) {
        if (document.id() == null || document.id().isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        Document luceneDoc = new Document();
        luceneDoc.add(new StringField(ID, document.id(), Store.YES));
        luceneDoc.add(new TextField(TITLE, nvl(document.title()), Store.YES));
        luceneDoc.add(new TextField(CONTENT, nvl(document.content()), Store.YES));
        luceneDoc.add(new StringField(CATEGORY, nvl(document.category()), Store.YES));
        luceneDoc.add(new StringField(SOURCE_TYPE, nvl(document.sourceType()), Store.YES));
        luceneDoc.add(new StoredField(AUTHOR, nvl(document.author())));
        luceneDoc.add(new StoredField(FILE_PATH, nvl(document.filePath())));
        luceneDoc.add(new StoredField(CREATED_AT, formatTimestamp(document.createdAt())));
        luceneDoc.add(new StoredField(UPDATED_AT, formatTimestamp(document.updatedAt())));
        return luceneDoc;
    }

    public static IndexedDocument fromLucene(Document doc) {
        return new IndexedDocument(
                doc.get(ID),
                nvl(doc.get(TITLE)),
                nvl(doc.get(CONTENT)),
                nvl(doc.get(CATEGORY)),
                nvl(doc.get(SOURCE_TYPE)),
                nvl(doc.get(AUTHOR)),
                nvl(doc.get(FILE_PATH)),
                parseTimestamp(doc.get(CREATED_AT)),
                parseTimestamp(doc.get(UPDATED_AT))
        );
    }

    public static String formatTimestamp(Instant instant) {
        return instant == null ? "" : TIMESTAMP.format(instant);
    }

    public static Instant parseTimestamp(String value) {
        if (value == null || value.isEmpty()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String nvl(String s) { return s == null ? "" : s; }
}
