package eu.virtualparadox.citeqa.query;

import eu.virtualparadox.citeqa.query.history.ConversationTurn;
import eu.virtualparadox.citeqa.rag.retriever.analysis.FilterHint;

import java.util.List;

/**
 * One question to answer.
 *
 * @param query       the user question, must not be blank
 * @param sessionId   optional session used for history and usage records
 * @param history     prior turns supplied by the caller; empty means ask the history provider
 * @param filterHints metadata hints supplied by the caller, applied even without auto filtering
 * @param filter      explicit filter expression; wins over any hints
 */
public record AnswerRequest(String query,
                            String sessionId,
                            List<ConversationTurn> history,
                            List<FilterHint> filterHints,
                            String filter) {

    public AnswerRequest {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        history = history == null ? List.of() : List.copyOf(history);
        filterHints = filterHints == null ? List.of() : List.copyOf(filterHints);
    }

    public static AnswerRequest of(final String query) {
        return new AnswerRequest(query, null, List.of(), List.of(), null);
    }
}
