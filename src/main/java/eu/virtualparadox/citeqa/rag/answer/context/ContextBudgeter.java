package eu.virtualparadox.citeqa.rag.answer.context;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Fits summaries and excerpts into the context window.
 * <p>
 * After the reserved overhead the budget is split between summaries and excerpts. Each list is
 * walked in relevance order; the first item that does not fit is cut down to the remaining
 * space when that space is still useful (over 100 tokens for summaries, over 200 for excerpts),
 * and everything after it is dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContextBudgeter {

    static final int MIN_USEFUL_SUMMARY_TOKENS = 100;
    static final int MIN_USEFUL_EXCERPT_TOKENS = 200;
    static final String ELLIPSIS = "...";

    private final ApplicationConfig props;

    public BudgetedContext fit(final List<SummaryItem> summaries, final List<ExcerptItem> excerpts) {
        final ApplicationConfig.Synthesizer cfg = props.getSynthesizer();
        return fit(summaries, excerpts, cfg.getMaxContextTokens());
    }

    /**
     * @param maxTokens total token budget including the reserved overhead
     */
    public BudgetedContext fit(final List<SummaryItem> summaries,
                               final List<ExcerptItem> excerpts,
                               final int maxTokens) {
        final ApplicationConfig.Synthesizer cfg = props.getSynthesizer();
        final int charsPerToken = Math.max(1, cfg.getCharsPerToken());
        final int available = Math.max(0, maxTokens - cfg.getReservedOverheadTokens());

        if (!cfg.isContextTruncationEnabled()) {
            return new BudgetedContext(summaries, excerpts,
                    estimateAll(summaries, charsPerToken), estimateAll(excerpts, charsPerToken), available, false);
        }

        final int summaryBudget = (int) (available * cfg.getSummaryShare());
        final int excerptBudget = (int) (available * (1.0 - cfg.getSummaryShare()));

        final Walk<SummaryItem> summaryWalk =
                walk(summaries, SummaryItem::withText, summaryBudget, MIN_USEFUL_SUMMARY_TOKENS, charsPerToken);
        final Walk<ExcerptItem> excerptWalk =
                walk(excerpts, ExcerptItem::withText, excerptBudget, MIN_USEFUL_EXCERPT_TOKENS, charsPerToken);

        log.info("Context truncation: {}/{} summaries, {}/{} excerpts",
                summaryWalk.kept.size(), summaries.size(), excerptWalk.kept.size(), excerpts.size());
        log.info("Token usage: ~{}/{}", summaryWalk.used + excerptWalk.used, available);

        return new BudgetedContext(
                summaryWalk.kept,
                excerptWalk.kept,
                summaryWalk.used,
                excerptWalk.used,
                available,
                summaryWalk.truncated || excerptWalk.truncated);
    }

    private <T extends RetrievedItem> Walk<T> walk(final List<T> items,
                                                   final BiFunction<T, String, T> withText,
                                                   final int budget,
                                                   final int minUseful,
                                                   final int charsPerToken) {
        final Walk<T> walk = new Walk<>();
        for (final T item : items) {
            final String text = item.text();
            final int tokens = TokenEstimator.estimate(text, charsPerToken);

            if (walk.used + tokens <= budget) {
                walk.kept.add(item);
                walk.used += tokens;
                continue;
            }

            walk.truncated = true;
            final int remaining = budget - walk.used;
            if (remaining > minUseful) {
                // the estimate of the shortened text never exceeds the remaining tokens
                final int chars = remaining * charsPerToken - ELLIPSIS.length();
                walk.kept.add(withText.apply(item, text.substring(0, Math.max(0, chars)) + ELLIPSIS));
                walk.used += remaining;
            }
            break;
        }
        return walk;
    }

    private static int estimateAll(final List<? extends RetrievedItem> items, final int charsPerToken) {
        int tokens = 0;
        for (final RetrievedItem item : items) {
            tokens += TokenEstimator.estimate(item.text(), charsPerToken);
        }
        return tokens;
    }

    private static final class Walk<T> {
        private final List<T> kept = new ArrayList<>();
        private int used;
        private boolean truncated;
    }
}
