package eu.virtualparadox.citeqa.rag.usage;

import eu.virtualparadox.citeqa.rag.llm.EModelErrorClass;
import eu.virtualparadox.citeqa.rag.llm.GenerationRequest;
import eu.virtualparadox.citeqa.rag.llm.GenerativeModelClient;
import eu.virtualparadox.citeqa.rag.llm.ModelErrorClassifier;
import eu.virtualparadox.citeqa.rag.llm.ModelResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

/**
 * Decorator recording every call of the wrapped client as a {@link GenerationAttempt}.
 * Provider errors are recorded and rethrown unchanged.
 */
@Slf4j
public class TrackingGenerativeModelClient implements GenerativeModelClient {

    private final GenerativeModelClient delegate;
    private final UsageTracker usageTracker;

    public TrackingGenerativeModelClient(final GenerativeModelClient delegate, final UsageTracker usageTracker) {
        this.delegate = delegate;
        this.usageTracker = usageTracker;
    }

    @Override
    public ModelResponse generate(final GenerationRequest request) {
        final Instant startedAt = Instant.now();
        final long start = System.nanoTime();

        final GenerationAttempt.GenerationAttemptBuilder attempt = GenerationAttempt.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(startedAt)
                .operation(request.operation())
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxOutputTokens())
                .sessionId(request.sessionId());

        try {
            final ModelResponse response = delegate.generate(request);
            attempt.status(EAttemptStatus.SUCCESS)
                    .inputTokens(response.usage().inputTokens())
                    .outputTokens(response.usage().outputTokens())
                    .totalTokens(response.usage().totalTokens());
            return response;
        } catch (RuntimeException e) {
            final EModelErrorClass errorClass = ModelErrorClassifier.classify(e);
            attempt.status(EAttemptStatus.ERROR)
                    .errorClass(errorClass)
                    .errorMessage(String.valueOf(e.getMessage()));
            throw e;
        } finally {
            attempt.latencyMs((System.nanoTime() - start) / 1_000_000.0);
            publish(attempt.build());
        }
    }

    private void publish(final GenerationAttempt attempt) {
        try {
            usageTracker.record(attempt);
        } catch (RuntimeException e) {
            log.error("Usage tracker rejected record {}", attempt.id(), e);
        }
    }
}
