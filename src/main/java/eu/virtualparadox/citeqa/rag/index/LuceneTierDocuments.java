package eu.virtualparadox.citeqa.rag.index;

import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.citeqa.util.LuceneConstants.*;

/**
 * Field layout shared by the writers and readers of both tier indexes.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code id}, {@code sourceId}, {@code organization}, {@code tags}: {@link StringField}, stored</li>
 *   <li>{@code text}: {@link TextField}, stored (excerpt content or summary text)</li>
 *   <li>{@code title}, {@code filename}, {@code author}, {@code date}, {@code sourceUri}: stored only</li>
 *   <li>{@code page}, {@code startSec}, {@code endSec}: stored only, excerpts only</li>
 * </ul>
 * Every stored field other than the text and the well-known columns ends up in the item's metadata map.
 */
public final class LuceneTierDocuments {

    private LuceneTierDocuments() {
        // prevent instantiation
    }

    public static Document toDocument(final ExcerptItem item) {
        final Document d = new Document();
        addIdentity(d, item.id(), item.sourceId(), item.title(), item.filename());
        d.add(new TextField(FIELD_TEXT, item.text(), Field.Store.YES));

        if (item.page() != null) {
            d.add(new StoredField(FIELD_PAGE, item.page()));
        }
        if (item.startSec() != null) {
            d.add(new StoredField(FIELD_START_SEC, item.startSec()));
        }
        if (item.endSec() != null) {
            d.add(new StoredField(FIELD_END_SEC, item.endSec()));
        }

        addMetadata(d, item.metadata());
        return d;
    }

    public static Document toDocument(final SummaryItem item) {
        final Document d = new Document();
        addIdentity(d, item.id(), item.sourceId(), item.title(), item.filename());
        d.add(new TextField(FIELD_TEXT, item.text(), Field.Store.YES));

        final Map<String, Object> metadata = new LinkedHashMap<>(item.metadata());
        putIfPresent(metadata, FIELD_AUTHOR, item.author());
        putIfPresent(metadata, FIELD_ORGANIZATION, item.organization());
        putIfPresent(metadata, FIELD_DATE, item.date());
        if (!item.tags().isEmpty()) {
            metadata.put(FIELD_TAGS, item.tags());
        }
        addMetadata(d, metadata);
        return d;
    }

    public static ExcerptItem toExcerpt(final Document doc, final float score) {
        final IndexableField page = doc.getField(FIELD_PAGE);
        final IndexableField startSec = doc.getField(FIELD_START_SEC);
        final IndexableField endSec = doc.getField(FIELD_END_SEC);

        return new ExcerptItem(
                doc.get(FIELD_ID),
                doc.get(FIELD_SOURCE_ID),
                doc.get(FIELD_TITLE),
                doc.get(FIELD_FILENAME),
                doc.get(FIELD_TEXT),
                score,
                page == null ? null : page.numericValue().intValue(),
                startSec == null ? null : startSec.numericValue().doubleValue(),
                endSec == null ? null : endSec.numericValue().doubleValue(),
                readMetadata(doc));
    }

    public static SummaryItem toSummary(final Document doc, final float score) {
        final Map<String, Object> metadata = readMetadata(doc);
        return new SummaryItem(
                doc.get(FIELD_ID),
                doc.get(FIELD_SOURCE_ID),
                doc.get(FIELD_TITLE),
                doc.get(FIELD_FILENAME),
                doc.get(FIELD_TEXT),
                score,
                doc.get(FIELD_AUTHOR),
                doc.get(FIELD_ORGANIZATION),
                doc.get(FIELD_DATE),
                List.of(doc.getValues(FIELD_TAGS)),
                metadata);
    }

    private static void addIdentity(final Document d,
                                    final String id,
                                    final String sourceId,
                                    final String title,
                                    final String filename) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Indexed items need an id");
        }
        d.add(new StringField(FIELD_ID, id, Field.Store.YES));
        if (sourceId != null) {
            d.add(new StringField(FIELD_SOURCE_ID, sourceId, Field.Store.YES));
        }
        if (title != null) {
            d.add(new StoredField(FIELD_TITLE, title));
        }
        if (filename != null) {
            d.add(new StoredField(FIELD_FILENAME, filename));
        }
    }

    private static void addMetadata(final Document d, final Map<String, Object> metadata) {
        for (final Map.Entry<String, Object> entry : metadata.entrySet()) {
            final String name = entry.getKey();
            if (isReserved(name) || entry.getValue() == null) {
                continue;
            }
            final boolean keyword = KEYWORD_FIELDS.contains(name);
            for (final Object value : asValues(entry.getValue())) {
                final String text = String.valueOf(value);
                d.add(keyword ? new StringField(name, text, Field.Store.YES) : new StoredField(name, text));
            }
        }
    }

    private static Map<String, Object> readMetadata(final Document doc) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        for (final IndexableField field : doc.getFields()) {
            final String name = field.name();
            if (isReserved(name) || metadata.containsKey(name)) {
                continue;
            }
            final String[] values = doc.getValues(name);
            if (FIELD_TAGS.equals(name)) {
                metadata.put(name, List.of(values));
            } else if (values.length > 0) {
                metadata.put(name, values[0]);
            }
        }
        return metadata;
    }

    private static boolean isReserved(final String name) {
        return FIELD_ID.equals(name)
                || FIELD_SOURCE_ID.equals(name)
                || FIELD_TITLE.equals(name)
                || FIELD_FILENAME.equals(name)
                || FIELD_TEXT.equals(name)
                || FIELD_PAGE.equals(name)
                || FIELD_START_SEC.equals(name)
                || FIELD_END_SEC.equals(name);
    }

    private static Collection<?> asValues(final Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        final List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    private static void putIfPresent(final Map<String, Object> metadata, final String key, final String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
