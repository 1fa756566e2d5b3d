package eu.virtualparadox.citeqa.rag.answer.context;

import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;

import java.util.List;

/**
 * Context that fits the token budget. Both lists are prefixes of the input lists; only their last
 * element may have been shortened.
 *
 * @param summaries          summaries to put into the prompt
 * @param excerpts           excerpts to put into the prompt
 * @param summaryTokens      estimated tokens used by the summaries
 * @param excerptTokens      estimated tokens used by the excerpts
 * @param availableTokens    budget after the reserved overhead
 * @param truncated          whether anything was shortened or dropped
 */
public record BudgetedContext(List<SummaryItem> summaries,
                              List<ExcerptItem> excerpts,
                              int summaryTokens,
                              int excerptTokens,
                              int availableTokens,
                              boolean truncated) {

    public BudgetedContext {
        summaries = List.copyOf(summaries);
        excerpts = List.copyOf(excerpts);
    }

    public int usedTokens() {
        return summaryTokens + excerptTokens;
    }
}
