package eu.virtualparadox.citeqa.rag.llm;

import java.util.Objects;

/**
 * One call to one model.
 *
 * @param model           model identifier understood by the provider
 * @param prompt          full prompt text
 * @param temperature     sampling temperature
 * @param maxOutputTokens upper bound for generated tokens
 * @param operation       what the call is for (tracking tag), e.g. {@code chat_answer}
 * @param sessionId       optional conversation id for tracking
 */
public record GenerationRequest(String model,
                                String prompt,
                                double temperature,
                                int maxOutputTokens,
                                String operation,
                                String sessionId) {

    public GenerationRequest {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
    }
}
