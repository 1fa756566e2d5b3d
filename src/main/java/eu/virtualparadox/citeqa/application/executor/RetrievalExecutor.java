package eu.virtualparadox.citeqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the per-variant search tier calls of a retrieval in parallel.
 */
public class RetrievalExecutor extends ThreadPoolTaskExecutor {
}
