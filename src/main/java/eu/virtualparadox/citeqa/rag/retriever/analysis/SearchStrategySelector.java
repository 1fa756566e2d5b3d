package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the {@link SearchStrategy} of a query.
 * <p>
 * Expansion is costly, so the adaptive strategy only expands complex queries and comparative,
 * analytical or exploratory ones; a simple factual query is never expanded. An explicit
 * {@code query-expansion-enabled} setting overrides the choice. The tier switches come from
 * configuration.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchStrategySelector {

    private final ApplicationConfig props;

    public SearchStrategy select(final QueryCharacteristics characteristics) {
        final ApplicationConfig.Retriever retriever = props.getRetriever();

        boolean expansion = !retriever.isAdaptiveStrategyEnabled() || expands(characteristics);
        if (retriever.getQueryExpansionEnabled() != null) {
            expansion = retriever.getQueryExpansionEnabled();
        }

        final SearchStrategy strategy = new SearchStrategy(
                expansion, retriever.isExcerptSearchEnabled(), retriever.isSummarySearchEnabled());
        log.info("Search strategy for {}/{}: {}", characteristics.type(), characteristics.complexity(), strategy);
        return strategy;
    }

    static boolean expands(final QueryCharacteristics characteristics) {
        if (characteristics.type() == EQueryType.FACTUAL && characteristics.complexity() == EQueryComplexity.SIMPLE) {
            return false;
        }
        return characteristics.complexity() == EQueryComplexity.COMPLEX
                || characteristics.type() == EQueryType.ANALYTICAL
                || characteristics.type() == EQueryType.EXPLORATORY
                || characteristics.type() == EQueryType.COMPARATIVE;
    }
}
