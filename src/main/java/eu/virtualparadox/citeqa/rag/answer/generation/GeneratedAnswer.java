package eu.virtualparadox.citeqa.rag.answer.generation;

import eu.virtualparadox.citeqa.rag.llm.TokenUsage;

/**
 * @param text      raw answer text, or the canned fallback text
 * @param modelUsed model that answered, {@link AnswerService#NO_MODEL_SUCCEEDED} if none did
 * @param usage     token usage of the successful call
 * @param attempts  number of models tried
 */
public record GeneratedAnswer(String text, String modelUsed, TokenUsage usage, int attempts) {

    public boolean isFallback() {
        return AnswerService.NO_MODEL_SUCCEEDED.equals(modelUsed);
    }
}
