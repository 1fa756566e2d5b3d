package eu.virtualparadox.citeqa.query.history;

import java.util.List;

/**
 * Read-only access to the prior turns of a session, oldest first.
 */
public interface ConversationHistoryProvider {

    List<ConversationTurn> history(String sessionId);
}
