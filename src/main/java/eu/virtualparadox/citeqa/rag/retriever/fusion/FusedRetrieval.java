package eu.virtualparadox.citeqa.rag.retriever.fusion;

import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;

import java.util.List;

/**
 * One ranked list per tier, free of duplicate identity keys.
 */
public record FusedRetrieval(List<ExcerptItem> excerpts, List<SummaryItem> summaries) {

    public FusedRetrieval {
        excerpts = List.copyOf(excerpts);
        summaries = List.copyOf(summaries);
    }
}
