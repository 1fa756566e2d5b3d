package eu.virtualparadox.citeqa.rag.retriever.model;

/**
 * Well-known keys of {@link RetrievedItem#metadata()}.
 */
public final class ItemMetadata {

    public static final String ORGANIZATION = "organization";
    public static final String TAGS = "tags";
    public static final String AUTHOR = "author";
    public static final String DATE = "date";
    public static final String SOURCE_URI = "sourceUri";

    private ItemMetadata() {
        // prevent instantiation
    }
}
