package eu.virtualparadox.citeqa.rag.answer.generation;

import eu.virtualparadox.citeqa.rag.answer.format.FormatDecision;
import eu.virtualparadox.citeqa.rag.llm.EModelErrorClass;
import eu.virtualparadox.citeqa.rag.llm.GenerationRequest;
import eu.virtualparadox.citeqa.rag.llm.GenerativeModelClient;
import eu.virtualparadox.citeqa.rag.llm.ModelErrorClassifier;
import eu.virtualparadox.citeqa.rag.llm.ModelResponse;
import eu.virtualparadox.citeqa.rag.llm.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates the answer text by walking the {@link ModelFallbackChain}.
 * <p>
 * Each candidate is tried once, in order, until one answers. Capacity problems (rate limit,
 * quota) are expected and logged as warnings; other failures are logged as errors; both move
 * on to the next candidate. When every candidate failed a canned answer is returned instead
 * of an exception. Every call is recorded by the tracking model client.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerService {

    public static final String OPERATION = "chat_answer";
    public static final String NO_MODEL_SUCCEEDED = "fallback-none";

    private final GenerativeModelClient modelClient;
    private final ModelFallbackChain fallbackChain;

    /**
     * @param query        the user query, used by the canned fallback
     * @param prompt       assembled prompt
     * @param format       format decision supplying temperature and output cap
     * @param summaryCount number of summaries in the prompt, used by the canned fallback
     * @param sessionId    optional session id for usage tracking
     * @return the answer of the first successful candidate, or the canned fallback
     */
    public GeneratedAnswer generate(final String query,
                                    final String prompt,
                                    final FormatDecision format,
                                    final int summaryCount,
                                    final String sessionId) {
        final FallbackChainRun run = fallbackChain.start();
        AttemptOutcome outcome = run.state();

        while (outcome instanceof AttemptOutcome.Retryable retryable) {
            final String candidate = retryable.candidate();
            log.info("Attempting model: {}", candidate);
            try {
                final ModelResponse response = modelClient.generate(new GenerationRequest(
                        candidate, prompt, format.temperature(), format.maxOutputTokens(), OPERATION, sessionId));
                outcome = run.succeeded(response);
            } catch (RuntimeException e) {
                final EModelErrorClass errorClass = ModelErrorClassifier.classify(e);
                if (errorClass.isCapacityProblem()) {
                    log.warn("Model {} unavailable ({}): {}", candidate, errorClass, e.getMessage());
                } else {
                    log.error("Model {} failed unexpectedly: {}", candidate, e.getMessage(), e);
                }
                outcome = run.failed(errorClass);
            }
        }

        if (outcome instanceof AttemptOutcome.Success success) {
            log.info("Answer generated with {}", success.model());
            return new GeneratedAnswer(success.response().text(), success.model(),
                    success.response().usage(), run.failures().size() + 1);
        }

        log.error("All {} models failed ({}), returning fallback answer", fallbackChain.models().size(), run.failures());
        return new GeneratedAnswer(fallbackText(query, summaryCount), NO_MODEL_SUCCEEDED,
                TokenUsage.NONE, run.failures().size());
    }

    static String fallbackText(final String query, final int summaryCount) {
        return "I apologize, but I'm currently experiencing high demand. "
                + "However, I found " + summaryCount + " relevant documents with information about: " + query + "\n\n"
                + "Please try again in a few moments.";
    }
}
