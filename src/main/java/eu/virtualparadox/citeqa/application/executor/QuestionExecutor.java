package eu.virtualparadox.citeqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs background question jobs.
 */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
