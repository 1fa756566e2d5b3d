package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.rag.retriever.model.ItemMetadata;

/**
 * Metadata dimension a filter hint restricts, with the field it maps to.
 */
public enum EFilterHintKind {
    ORGANIZATION(ItemMetadata.ORGANIZATION),
    TOPIC(ItemMetadata.TAGS);

    private final String field;

    EFilterHintKind(final String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }
}
