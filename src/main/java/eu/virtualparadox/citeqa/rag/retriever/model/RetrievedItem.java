package eu.virtualparadox.citeqa.rag.retriever.model;

import java.util.Map;

/**
 * A single hit returned by one of the two search tiers.
 * <p>
 * The two variants differ in what they anchor to: an {@link ExcerptItem} points at a
 * location inside a source (page or time range), a {@link SummaryItem} describes the
 * whole source.
 */
public sealed interface RetrievedItem permits ExcerptItem, SummaryItem {

    String id();

    String sourceId();

    String title();

    String filename();

    float score();

    Map<String, Object> metadata();

    /**
     * @return the text handed to the model (excerpt content or summary text)
     */
    String text();

    /**
     * Deduplication key; unique within a result set after deduplication.
     */
    String identityKey();

    ETier tier();
}
