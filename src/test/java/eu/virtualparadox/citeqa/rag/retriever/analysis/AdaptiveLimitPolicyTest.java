package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link AdaptiveLimitPolicy}.
 */
class AdaptiveLimitPolicyTest {

    @Test
    @DisplayName("Word count thresholds")
    void testWordCount() {
        assertEquals(new RetrievalLimits(5, 3), AdaptiveLimitPolicy.byWordCount(4));
        assertEquals(new RetrievalLimits(10, 5), AdaptiveLimitPolicy.byWordCount(5));
        assertEquals(new RetrievalLimits(10, 5), AdaptiveLimitPolicy.byWordCount(14));
        assertEquals(new RetrievalLimits(15, 7), AdaptiveLimitPolicy.byWordCount(15));
    }

    @Test
    @DisplayName("Characteristics scale the base limits and respect the caps")
    void testCharacteristics() {
        assertEquals(new RetrievalLimits(20, 10), AdaptiveLimitPolicy.byCharacteristics(characteristics(
                EQueryType.ANALYTICAL, EQueryComplexity.COMPLEX, EQueryScope.BROAD)));
        assertEquals(new RetrievalLimits(3, 2), AdaptiveLimitPolicy.byCharacteristics(characteristics(
                EQueryType.FACTUAL, EQueryComplexity.SIMPLE, EQueryScope.NARROW)));
        assertEquals(new RetrievalLimits(8, 6), AdaptiveLimitPolicy.byCharacteristics(characteristics(
                EQueryType.COMPARATIVE, EQueryComplexity.MODERATE, EQueryScope.MEDIUM)));
    }

    @Test
    @DisplayName("Configured strategy selects the rule")
    void testStrategySelection() {
        final ApplicationConfig props = new ApplicationConfig();
        final AdaptiveLimitPolicy policy = new AdaptiveLimitPolicy(props);
        final QueryCharacteristics c = characteristics(EQueryType.ANALYTICAL, EQueryComplexity.COMPLEX, EQueryScope.BROAD);

        assertEquals(new RetrievalLimits(5, 3), policy.limitsFor(c));

        props.getRetriever().setAdaptiveLimits(ApplicationConfig.EAdaptiveLimits.CHARACTERISTICS);
        assertEquals(new RetrievalLimits(20, 10), policy.limitsFor(c));

        props.getRetriever().setAdaptiveLimits(ApplicationConfig.EAdaptiveLimits.NONE);
        assertEquals(new RetrievalLimits(10, 5), policy.limitsFor(c));
    }

    private static QueryCharacteristics characteristics(final EQueryType type,
                                                        final EQueryComplexity complexity,
                                                        final EQueryScope scope) {
        return new QueryCharacteristics(3, type, complexity, scope, List.of());
    }
}
