package eu.virtualparadox.citeqa.rag.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ModelErrorClassifier}.
 */
class ModelErrorClassifierTest {

    @Test
    @DisplayName("HTTP 429 responses are rate limits")
    void testTooManyRequests() {
        assertEquals(EModelErrorClass.RATE_LIMITED,
                ModelErrorClassifier.classify(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)));
    }

    @Test
    @DisplayName("Rate limit found in the cause chain")
    void testWrappedRateLimit() {
        final RuntimeException wrapped = new RuntimeException("call failed",
                new IllegalStateException("Rate limit reached for requests"));
        assertEquals(EModelErrorClass.RATE_LIMITED, ModelErrorClassifier.classify(wrapped));
    }

    @Test
    @DisplayName("Throttling transient errors are rate limits")
    void testThrottled() {
        assertEquals(EModelErrorClass.RATE_LIMITED,
                ModelErrorClassifier.classify(new TransientAiException("Request throttled by provider")));
    }

    @Test
    @DisplayName("Quota wins over rate limit")
    void testQuota() {
        assertEquals(EModelErrorClass.QUOTA_EXCEEDED,
                ModelErrorClassifier.classify(new RuntimeException("429: You exceeded your current quota")));
        assertEquals(EModelErrorClass.QUOTA_EXCEEDED,
                ModelErrorClassifier.classify(new RuntimeException("Insufficient balance")));
    }

    @Test
    @DisplayName("Anything else is other")
    void testOther() {
        assertEquals(EModelErrorClass.OTHER, ModelErrorClassifier.classify(new IllegalStateException("connection refused")));
        assertEquals(EModelErrorClass.OTHER, ModelErrorClassifier.classify(new RuntimeException((String) null)));
        assertEquals(EModelErrorClass.OTHER, ModelErrorClassifier.classify(null));
        assertFalse(EModelErrorClass.OTHER.isCapacityProblem());
        assertTrue(EModelErrorClass.QUOTA_EXCEEDED.isCapacityProblem());
    }
}
