package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.application.config.ApplicationConfig.EAdaptiveLimits;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sizes a retrieval: shorter and simpler queries ask both tiers for fewer results.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AdaptiveLimitPolicy {

    static final int MAX_EXCERPTS_CAP = 20;
    static final int MAX_SUMMARIES_CAP = 10;

    private final ApplicationConfig props;

    /**
     * Applies the configured strategy.
     */
    public RetrievalLimits limitsFor(final QueryCharacteristics characteristics) {
        final ApplicationConfig.Retriever retriever = props.getRetriever();
        final EAdaptiveLimits strategy = retriever.getAdaptiveLimits();
        if (strategy == EAdaptiveLimits.WORD_COUNT) {
            return byWordCount(characteristics.wordCount());
        }
        if (strategy == EAdaptiveLimits.CHARACTERISTICS) {
            return byCharacteristics(characteristics);
        }
        return new RetrievalLimits(retriever.getDefaultMaxExcerpts(), retriever.getDefaultMaxSummaries());
    }

    /**
     * &lt;5 words: 5/3, &lt;15 words: 10/5, otherwise 15/7.
     */
    public static RetrievalLimits byWordCount(final int wordCount) {
        if (wordCount < 5) {
            return new RetrievalLimits(5, 3);
        }
        if (wordCount < 15) {
            return new RetrievalLimits(10, 5);
        }
        return new RetrievalLimits(15, 7);
    }

    /**
     * Base limits per query type, scaled by complexity and scope, capped at
     * {@value #MAX_EXCERPTS_CAP} excerpts and {@value #MAX_SUMMARIES_CAP} summaries.
     */
    public static RetrievalLimits byCharacteristics(final QueryCharacteristics characteristics) {
        int excerpts;
        int summaries;
        switch (characteristics.type()) {
            case FACTUAL -> {
                excerpts = 5;
                summaries = 2;
            }
            case PROCEDURAL -> {
                excerpts = 12;
                summaries = 3;
            }
            case COMPARATIVE -> {
                excerpts = 8;
                summaries = 6;
            }
            case ANALYTICAL -> {
                excerpts = 15;
                summaries = 7;
            }
            default -> {
                excerpts = 10;
                summaries = 5;
            }
        }

        if (characteristics.complexity() == EQueryComplexity.SIMPLE) {
            excerpts = Math.max(3, (int) (excerpts * 0.6));
            summaries = Math.max(2, (int) (summaries * 0.6));
        } else if (characteristics.complexity() == EQueryComplexity.COMPLEX) {
            excerpts = (int) (excerpts * 1.5);
            summaries = (int) (summaries * 1.4);
        }

        if (characteristics.scope() == EQueryScope.NARROW) {
            excerpts = Math.max(3, (int) (excerpts * 0.7));
            summaries = Math.max(2, (int) (summaries * 0.7));
        } else if (characteristics.scope() == EQueryScope.BROAD) {
            excerpts = (int) (excerpts * 1.3);
            summaries = (int) (summaries * 1.3);
        }

        final RetrievalLimits limits = new RetrievalLimits(
                Math.min(excerpts, MAX_EXCERPTS_CAP),
                Math.min(summaries, MAX_SUMMARIES_CAP));
        log.info("Adaptive limits for {}/{}/{}: {} excerpts, {} summaries",
                characteristics.type(), characteristics.complexity(), characteristics.scope(),
                limits.maxExcerpts(), limits.maxSummaries());
        return limits;
    }
}
