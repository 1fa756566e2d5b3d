package eu.virtualparadox.citeqa.rag.llm;

/**
 * Blocking access to a generative language model.
 * <p>
 * Implementations throw unchecked exceptions on provider errors; callers classify them with
 * {@link ModelErrorClassifier}.
 */
public interface GenerativeModelClient {

    /**
     * @param request model, prompt and sampling parameters
     * @return generated text and token usage
     */
    ModelResponse generate(GenerationRequest request);
}
