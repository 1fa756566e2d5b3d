package eu.virtualparadox.citeqa.rag.retriever.model;

import java.util.List;

/**
 * Raw per-variant ranked lists of both tiers, in variant order.
 * A failed tier call is represented by an empty list at its position.
 */
public record TwoTierRetrieval(List<List<ExcerptItem>> excerptLists,
                               List<List<SummaryItem>> summaryLists) {

    public TwoTierRetrieval {
        excerptLists = List.copyOf(excerptLists);
        summaryLists = List.copyOf(summaryLists);
    }
}
