package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SearchStrategySelector}.
 */
class SearchStrategySelectorTest {

    private ApplicationConfig props;
    private SearchStrategySelector selector;

    @BeforeEach
    void setUp() {
        props = new ApplicationConfig();
        selector = new SearchStrategySelector(props);
    }

    @Test
    void expandsOnlyWhereItHelps() {
        assertFalse(selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.SIMPLE)).queryExpansion());
        assertFalse(selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.MODERATE)).queryExpansion());
        assertFalse(selector.select(characteristics(EQueryType.PROCEDURAL, EQueryComplexity.MODERATE)).queryExpansion());

        assertTrue(selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.COMPLEX)).queryExpansion());
        assertTrue(selector.select(characteristics(EQueryType.COMPARATIVE, EQueryComplexity.SIMPLE)).queryExpansion());
        assertTrue(selector.select(characteristics(EQueryType.ANALYTICAL, EQueryComplexity.MODERATE)).queryExpansion());
        assertTrue(selector.select(characteristics(EQueryType.EXPLORATORY, EQueryComplexity.MODERATE)).queryExpansion());
    }

    @Test
    void explicitSettingOverridesTheStrategy() {
        props.getRetriever().setQueryExpansionEnabled(true);
        assertTrue(selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.SIMPLE)).queryExpansion());

        props.getRetriever().setQueryExpansionEnabled(false);
        assertFalse(selector.select(characteristics(EQueryType.ANALYTICAL, EQueryComplexity.COMPLEX)).queryExpansion());
    }

    @Test
    void nonAdaptiveStrategyAlwaysExpands() {
        props.getRetriever().setAdaptiveStrategyEnabled(false);
        assertTrue(selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.SIMPLE)).queryExpansion());
    }

    @Test
    void disabledTierGetsNoResults() {
        props.getRetriever().setExcerptSearchEnabled(false);

        final SearchStrategy strategy = selector.select(characteristics(EQueryType.FACTUAL, EQueryComplexity.SIMPLE));

        assertFalse(strategy.searchExcerpts());
        assertTrue(strategy.searchSummaries());
        assertEquals(new RetrievalLimits(0, 3), strategy.restrict(new RetrievalLimits(5, 3)));
    }

    private static QueryCharacteristics characteristics(final EQueryType type, final EQueryComplexity complexity) {
        return new QueryCharacteristics(6, type, complexity, EQueryScope.MEDIUM, List.of());
    }
}
