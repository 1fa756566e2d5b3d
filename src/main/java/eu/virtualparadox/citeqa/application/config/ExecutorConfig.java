package eu.virtualparadox.citeqa.application.config;

import eu.virtualparadox.citeqa.application.executor.QuestionExecutor;
import eu.virtualparadox.citeqa.application.executor.RetrievalExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public QuestionExecutor questionExecutor() {
        QuestionExecutor executor = new QuestionExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("question-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public RetrievalExecutor retrievalExecutor() {
        RetrievalExecutor executor = new RetrievalExecutor();
        executor.setCorePoolSize(4);        // two tiers times a couple of variants
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("retrieve-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
