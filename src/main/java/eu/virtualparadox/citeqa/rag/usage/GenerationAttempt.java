package eu.virtualparadox.citeqa.rag.usage;

import eu.virtualparadox.citeqa.rag.llm.EModelErrorClass;
import lombok.Builder;

import java.time.Instant;

/**
 * Record of one call to one model, successful or not.
 *
 * @param id           unique call id
 * @param timestamp    when the call started
 * @param operation    what the call was for (e.g. {@code chat_answer}, {@code rerank})
 * @param model        model identifier
 * @param inputTokens  prompt tokens reported by the provider
 * @param outputTokens generated tokens reported by the provider
 * @param totalTokens  total tokens reported by the provider
 * @param latencyMs    wall-clock duration of the call
 * @param status       outcome
 * @param errorClass   classification of the failure, {@code null} on success
 * @param errorMessage provider error detail, {@code null} on success
 * @param temperature  requested temperature
 * @param maxTokens    requested output token cap
 * @param sessionId    conversation id, may be {@code null}
 */
@Builder
public record GenerationAttempt(String id,
                                Instant timestamp,
                                String operation,
                                String model,
                                int inputTokens,
                                int outputTokens,
                                int totalTokens,
                                double latencyMs,
                                EAttemptStatus status,
                                EModelErrorClass errorClass,
                                String errorMessage,
                                Double temperature,
                                Integer maxTokens,
                                String sessionId) {

    public boolean succeeded() {
        return status == EAttemptStatus.SUCCESS;
    }
}
