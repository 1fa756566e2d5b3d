package eu.virtualparadox.citeqa.rag.llm;

public record TokenUsage(int inputTokens, int outputTokens, int totalTokens) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);

    public static TokenUsage of(final Integer input, final Integer output, final Integer total) {
        final int in = input == null ? 0 : input;
        final int out = output == null ? 0 : output;
        final int sum = total == null || total == 0 ? in + out : total;
        return new TokenUsage(in, out, sum);
    }
}
