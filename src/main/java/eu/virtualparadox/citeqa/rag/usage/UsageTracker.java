package eu.virtualparadox.citeqa.rag.usage;

/**
 * Append-only sink for {@link GenerationAttempt} records.
 * <p>
 * Implementations must accept concurrent writers, write each record atomically and never
 * propagate their own failures to the caller.
 */
public interface UsageTracker {

    void record(GenerationAttempt attempt);
}
