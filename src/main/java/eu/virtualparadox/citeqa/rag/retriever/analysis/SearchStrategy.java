package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;

/**
 * Which parts of retrieval run for one query.
 *
 * @param queryExpansion  whether to ask the model for query variants
 * @param searchExcerpts  whether the excerpt tier is queried
 * @param searchSummaries whether the summary tier is queried
 */
public record SearchStrategy(boolean queryExpansion, boolean searchExcerpts, boolean searchSummaries) {

    /**
     * Zeroes the cap of every tier that is not searched.
     */
    public RetrievalLimits restrict(final RetrievalLimits limits) {
        return new RetrievalLimits(
                searchExcerpts ? limits.maxExcerpts() : 0,
                searchSummaries ? limits.maxSummaries() : 0);
    }
}
