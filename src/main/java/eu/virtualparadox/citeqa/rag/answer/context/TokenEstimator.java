package eu.virtualparadox.citeqa.rag.answer.context;

/**
 * Character based token estimate.
 */
public final class TokenEstimator {

    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
        // prevent instantiation
    }

    public static int estimate(final String text) {
        return estimate(text, DEFAULT_CHARS_PER_TOKEN);
    }

    public static int estimate(final String text, final int charsPerToken) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.length() / Math.max(1, charsPerToken);
    }
}
