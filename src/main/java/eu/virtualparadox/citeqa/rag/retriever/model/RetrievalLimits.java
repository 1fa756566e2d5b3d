package eu.virtualparadox.citeqa.rag.retriever.model;

/**
 * Per-tier result caps for one query.
 */
public record RetrievalLimits(int maxExcerpts, int maxSummaries) {

    public RetrievalLimits {
        if (maxExcerpts < 0 || maxSummaries < 0) {
            throw new IllegalArgumentException("Limits must not be negative: " + maxExcerpts + "/" + maxSummaries);
        }
    }
}
