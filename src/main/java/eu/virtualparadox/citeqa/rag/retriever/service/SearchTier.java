package eu.virtualparadox.citeqa.rag.retriever.service;

import eu.virtualparadox.citeqa.rag.retriever.model.ETier;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;

import java.io.IOException;
import java.util.List;

/**
 * One of the two independent search indexes.
 *
 * @param <T> item type returned by the tier
 */
public interface SearchTier<T extends RetrievedItem> {

    /**
     * Searches the tier.
     *
     * @param query  free text query
     * @param limit  maximum number of hits
     * @param filter optional filter expression in the tier's query syntax, may be {@code null}
     * @return hits, best first; empty if nothing matched
     * @throws IOException if the index cannot be read or the filter is invalid
     */
    List<T> search(String query, int limit, String filter) throws IOException;

    ETier tier();
}
