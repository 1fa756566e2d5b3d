package eu.virtualparadox.citeqa.rag.retriever.analysis;

import java.util.List;

/**
 * Heuristic profile of a query, used to size retrieval and to derive metadata filters.
 *
 * @param wordCount   number of whitespace separated words
 * @param type        dominant intent
 * @param complexity  length and depth signal
 * @param scope       narrow or broad wording
 * @param filterHints at most one organization hint and one topic hint
 */
public record QueryCharacteristics(int wordCount,
                                   EQueryType type,
                                   EQueryComplexity complexity,
                                   EQueryScope scope,
                                   List<FilterHint> filterHints) {

    public QueryCharacteristics {
        filterHints = filterHints == null ? List.of() : List.copyOf(filterHints);
    }
}
