package eu.virtualparadox.citeqa.query.history;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default provider: sessions are not persisted, so there is never any history.
 */
@Component
public class NoConversationHistoryProvider implements ConversationHistoryProvider {

    @Override
    public List<ConversationTurn> history(final String sessionId) {
        return List.of();
    }
}
