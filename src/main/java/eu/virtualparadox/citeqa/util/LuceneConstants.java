package eu.virtualparadox.citeqa.util;

import eu.virtualparadox.citeqa.rag.retriever.model.ItemMetadata;

import java.util.Set;

public class LuceneConstants {
    public static final String FIELD_ID = "id";
    public static final String FIELD_SOURCE_ID = "sourceId";
    public static final String FIELD_TITLE = "title";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_PAGE = "page";
    public static final String FIELD_START_SEC = "startSec";
    public static final String FIELD_END_SEC = "endSec";
    public static final String FIELD_ORGANIZATION = ItemMetadata.ORGANIZATION;
    public static final String FIELD_TAGS = ItemMetadata.TAGS;
    public static final String FIELD_AUTHOR = ItemMetadata.AUTHOR;
    public static final String FIELD_DATE = ItemMetadata.DATE;
    public static final String FIELD_SOURCE_URI = ItemMetadata.SOURCE_URI;

    /** Fields indexed verbatim; filter expressions on them are matched exactly. */
    public static final Set<String> KEYWORD_FIELDS = Set.of(
            FIELD_ID, FIELD_SOURCE_ID, FIELD_ORGANIZATION, FIELD_TAGS);

    private LuceneConstants() {
        // prevent instantiation
    }
}
