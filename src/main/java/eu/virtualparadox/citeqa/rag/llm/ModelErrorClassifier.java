package eu.virtualparadox.citeqa.rag.llm;

import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClientResponseException;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a provider failure to an {@link EModelErrorClass}.
 * <p>
 * Walks the cause chain once. HTTP 429 responses and transient provider errors that mention
 * throttling are {@link EModelErrorClass#RATE_LIMITED}; messages about exhausted quota or
 * insufficient balance are {@link EModelErrorClass#QUOTA_EXCEEDED}; anything else is
 * {@link EModelErrorClass#OTHER}.
 */
public final class ModelErrorClassifier {

    private static final String[] QUOTA_MARKERS = {
            "quota", "insufficient", "resource exhausted", "resource_exhausted", "billing"
    };

    private static final String[] RATE_MARKERS = {
            "429", "rate limit", "rate_limit", "ratelimit", "too many requests"
    };

    private ModelErrorClassifier() {
        // prevent instantiation
    }

    public static EModelErrorClass classify(final Throwable error) {
        if (error == null) {
            return EModelErrorClass.OTHER;
        }

        boolean rateLimited = false;
        final Set<Throwable> visited = new HashSet<>();
        for (Throwable current = error; current != null && visited.add(current); current = current.getCause()) {
            final String message = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);

            if (containsAny(message, QUOTA_MARKERS)) {
                return EModelErrorClass.QUOTA_EXCEEDED;
            }
            if (current instanceof RestClientResponseException responseException
                    && responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                rateLimited = true;
            }
            if (containsAny(message, RATE_MARKERS)) {
                rateLimited = true;
            }
            if (current instanceof TransientAiException && message.contains("throttl")) {
                rateLimited = true;
            }
        }
        return rateLimited ? EModelErrorClass.RATE_LIMITED : EModelErrorClass.OTHER;
    }

    private static boolean containsAny(final String message, final String[] markers) {
        for (final String marker : markers) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
