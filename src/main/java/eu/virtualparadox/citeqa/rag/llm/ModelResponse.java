package eu.virtualparadox.citeqa.rag.llm;

public record ModelResponse(String text, TokenUsage usage) {

    public ModelResponse {
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
