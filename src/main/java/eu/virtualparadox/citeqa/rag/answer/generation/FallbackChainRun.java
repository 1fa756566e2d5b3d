package eu.virtualparadox.citeqa.rag.answer.generation;

import eu.virtualparadox.citeqa.rag.llm.EModelErrorClass;
import eu.virtualparadox.citeqa.rag.llm.ModelResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One pass over a {@link ModelFallbackChain}.
 * <p>
 * States: a candidate is pending, the run succeeded, or the run is exhausted. Every failure
 * class advances to the next candidate; the class is only kept for reporting. No candidate is
 * tried twice. Not thread-safe; a run belongs to one request.
 */
public final class FallbackChainRun {

    private final List<String> candidates;
    private final List<EModelErrorClass> failures = new ArrayList<>();
    private int index;
    private AttemptOutcome state;

    FallbackChainRun(final List<String> candidates) {
        this.candidates = candidates;
        this.index = 0;
        this.state = candidates.isEmpty()
                ? new AttemptOutcome.Exhausted(0)
                : new AttemptOutcome.Retryable(candidates.get(0));
    }

    public AttemptOutcome state() {
        return state;
    }

    /**
     * The pending candidate answered.
     */
    public AttemptOutcome succeeded(final ModelResponse response) {
        final String candidate = pendingCandidate();
        state = new AttemptOutcome.Success(candidate, response);
        return state;
    }

    /**
     * The pending candidate failed; moves to the next candidate or to exhaustion.
     */
    public AttemptOutcome failed(final EModelErrorClass errorClass) {
        pendingCandidate();
        failures.add(errorClass);
        index++;
        state = index < candidates.size()
                ? new AttemptOutcome.Retryable(candidates.get(index))
                : new AttemptOutcome.Exhausted(failures.size());
        return state;
    }

    public List<EModelErrorClass> failures() {
        return Collections.unmodifiableList(failures);
    }

    private String pendingCandidate() {
        if (!(state instanceof AttemptOutcome.Retryable retryable)) {
            throw new IllegalStateException("No candidate pending, run is " + state);
        }
        return retryable.candidate();
    }
}
