package eu.virtualparadox.citeqa.rag.rerank.service;

import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;

import java.util.List;

/**
 * Service interface for re-ranking retrieved items.
 * <p>
 * Implementations must never drop an item other than through the cap and must never throw:
 * on failure they return the input order, capped.
 */
public interface RerankService {

    /**
     * Reorders the items by relevance to the query.
     *
     * @param query the user query
     * @param items the candidates, in their current order
     * @param topK  optional cap applied after reordering, {@code null} for none
     * @param <T>   item type
     * @return reordered (and possibly capped) items
     */
    <T extends RetrievedItem> List<T> rerank(String query, List<T> items, Integer topK);
}
