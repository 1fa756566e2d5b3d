package eu.virtualparadox.citeqa.query.history;

/**
 * One prior message of a conversation.
 *
 * @param role    {@code user} or {@code assistant}
 * @param content message text
 */
public record ConversationTurn(String role, String content) {

    public static ConversationTurn user(final String content) {
        return new ConversationTurn("user", content);
    }

    public static ConversationTurn assistant(final String content) {
        return new ConversationTurn("assistant", content);
    }
}
