package eu.virtualparadox.citeqa.rag.answer.generation;

import eu.virtualparadox.citeqa.rag.llm.ModelResponse;

/**
 * Result of a transition of {@link FallbackChainRun}.
 */
public sealed interface AttemptOutcome
        permits AttemptOutcome.Success, AttemptOutcome.Retryable, AttemptOutcome.Exhausted {

    /** A candidate answered; the run is over. */
    record Success(String model, ModelResponse response) implements AttemptOutcome {
    }

    /** The given candidate is next in line. */
    record Retryable(String candidate) implements AttemptOutcome {
    }

    /** Every candidate failed. */
    record Exhausted(int attempts) implements AttemptOutcome {
    }
}
