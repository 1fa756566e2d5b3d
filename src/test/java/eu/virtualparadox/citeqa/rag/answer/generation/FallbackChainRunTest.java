package eu.virtualparadox.citeqa.rag.answer.generation;

import eu.virtualparadox.citeqa.rag.llm.EModelErrorClass;
import eu.virtualparadox.citeqa.rag.llm.ModelResponse;
import eu.virtualparadox.citeqa.rag.llm.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FallbackChainRun} and {@link ModelFallbackChain}.
 */
class FallbackChainRunTest {

    private final ModelFallbackChain chain = ModelFallbackChain.of("primary", List.of("second", "third"));

    @Test
    @DisplayName("Run starts with the primary model pending")
    void startsWithPrimary() {
        assertThat(chain.start().state()).isEqualTo(new AttemptOutcome.Retryable("primary"));
    }

    @Test
    @DisplayName("Failures advance through the candidates in order")
    void failuresAdvance() {
        final FallbackChainRun run = chain.start();

        assertThat(run.failed(EModelErrorClass.RATE_LIMITED)).isEqualTo(new AttemptOutcome.Retryable("second"));
        assertThat(run.failed(EModelErrorClass.OTHER)).isEqualTo(new AttemptOutcome.Retryable("third"));

        final ModelResponse response = new ModelResponse("answer", TokenUsage.of(10, 5, null));
        assertThat(run.succeeded(response)).isEqualTo(new AttemptOutcome.Success("third", response));
        assertThat(run.failures()).containsExactly(EModelErrorClass.RATE_LIMITED, EModelErrorClass.OTHER);
    }

    @Test
    @DisplayName("Failing every candidate exhausts the run")
    void exhaustion() {
        final FallbackChainRun run = chain.start();
        run.failed(EModelErrorClass.QUOTA_EXCEEDED);
        run.failed(EModelErrorClass.QUOTA_EXCEEDED);

        assertThat(run.failed(EModelErrorClass.OTHER)).isEqualTo(new AttemptOutcome.Exhausted(3));
        assertThatThrownBy(() -> run.failed(EModelErrorClass.OTHER)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.succeeded(new ModelResponse("late", null))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Finished run rejects further transitions")
    void successIsFinal() {
        final FallbackChainRun run = chain.start();
        run.succeeded(new ModelResponse("ok", null));

        assertThatThrownBy(() -> run.failed(EModelErrorClass.OTHER)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Chain drops blank and repeated model names")
    void chainNormalization() {
        final ModelFallbackChain normalized = ModelFallbackChain.of(" primary ", Arrays.asList("second", "", null, "primary"));

        assertThat(normalized.models()).containsExactly("primary", "second");
        assertThat(normalized.primary()).isEqualTo("primary");
        assertThatThrownBy(() -> normalized.models().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ModelFallbackChain.of(" ", List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
