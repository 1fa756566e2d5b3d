package eu.virtualparadox.citeqa.application.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.citeqa.rag.answer.generation.ModelFallbackChain;
import eu.virtualparadox.citeqa.rag.llm.GenerativeModelClient;
import eu.virtualparadox.citeqa.rag.llm.SpringAiGenerativeModelClient;
import eu.virtualparadox.citeqa.rag.usage.JsonlUsageTracker;
import eu.virtualparadox.citeqa.rag.usage.TrackingGenerativeModelClient;
import eu.virtualparadox.citeqa.rag.usage.UsageTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;

/**
 * Process-wide generation collaborators: the model fallback chain, the usage tracker and the
 * tracking model client every component calls through.
 */
@Configuration
@Slf4j
public class GenerationConfig {

    /**
     * Built once from {@code citeqa.generation.*}; never mutated afterwards.
     */
    @Bean
    public ModelFallbackChain modelFallbackChain(final ApplicationConfig props) {
        final ApplicationConfig.Generation generation = props.getGeneration();
        final ModelFallbackChain chain = ModelFallbackChain.of(generation.getPrimaryModel(), generation.getFallbackModels());
        log.info("Model fallback chain: {}", chain.models());
        return chain;
    }

    @Bean
    public UsageTracker usageTracker(final ApplicationConfig props, final ObjectMapper objectMapper) {
        final ApplicationConfig.Tracking tracking = props.getTracking();
        if (!tracking.isEnabled() || tracking.getFile() == null) {
            log.info("Usage tracking disabled");
            return attempt -> log.debug("Untracked model call {} via {}", attempt.operation(), attempt.model());
        }
        final Path file = tracking.getFile();
        return new JsonlUsageTracker(file, objectMapper);
    }

    @Bean
    @Primary
    public GenerativeModelClient trackingGenerativeModelClient(final SpringAiGenerativeModelClient springAiClient,
                                                               final UsageTracker usageTracker) {
        return new TrackingGenerativeModelClient(springAiClient, usageTracker);
    }
}
