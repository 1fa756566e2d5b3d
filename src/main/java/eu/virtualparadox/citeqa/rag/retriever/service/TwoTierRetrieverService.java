package eu.virtualparadox.citeqa.rag.retriever.service;

import eu.virtualparadox.citeqa.application.executor.RetrievalExecutor;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import eu.virtualparadox.citeqa.rag.retriever.model.TwoTierRetrieval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Queries both search tiers once per query variant.
 * <p>
 * All calls run in parallel on the {@link RetrievalExecutor}; the method returns only after every
 * call has finished. A call the executor rejects runs on the calling thread instead. A failing
 * call is logged and contributes an empty list at its position, so the result always has one
 * list per variant and tier. A tier with a limit of zero is not queried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TwoTierRetrieverService {

    private final SearchTier<ExcerptItem> excerptTier;
    private final SearchTier<SummaryItem> summaryTier;
    private final RetrievalExecutor retrievalExecutor;

    /**
     * @param variants query variants, original first
     * @param limits   per-tier result caps
     * @param filter   optional filter expression applied to both tiers, may be {@code null}
     * @return per-tier ranked lists, in variant order
     */
    public TwoTierRetrieval retrieve(final List<String> variants,
                                     final RetrievalLimits limits,
                                     final String filter) {
        final List<CompletableFuture<List<ExcerptItem>>> excerptCalls = new ArrayList<>(variants.size());
        final List<CompletableFuture<List<SummaryItem>>> summaryCalls = new ArrayList<>(variants.size());

        for (final String variant : variants) {
            log.info("Searching with variation: {}", variant);
            excerptCalls.add(submit(() -> searchQuietly(excerptTier, variant, limits.maxExcerpts(), filter),
                    limits.maxExcerpts()));
            summaryCalls.add(submit(() -> searchQuietly(summaryTier, variant, limits.maxSummaries(), filter),
                    limits.maxSummaries()));
        }

        final List<List<ExcerptItem>> excerptLists = joinAll(excerptCalls);
        final List<List<SummaryItem>> summaryLists = joinAll(summaryCalls);

        log.info("Retrieved {} variants: {} excerpt hits, {} summary hits",
                variants.size(), countHits(excerptLists), countHits(summaryLists));
        return new TwoTierRetrieval(excerptLists, summaryLists);
    }

    private <T> CompletableFuture<List<T>> submit(final Supplier<List<T>> call, final int limit) {
        if (limit <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        try {
            return CompletableFuture.supplyAsync(call, retrievalExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Retrieval executor saturated, searching on the calling thread");
            return CompletableFuture.completedFuture(call.get());
        }
    }

    private <T extends RetrievedItem> List<T> searchQuietly(final SearchTier<T> tier,
                                                            final String query,
                                                            final int limit,
                                                            final String filter) {
        try {
            return tier.search(query, limit, filter);
        } catch (Exception e) {
            log.warn("{} tier search failed for '{}', continuing without it", tier.tier(), query, e);
            return List.of();
        }
    }

    private static <T> List<List<T>> joinAll(final List<CompletableFuture<List<T>>> calls) {
        final List<List<T>> lists = new ArrayList<>(calls.size());
        for (final CompletableFuture<List<T>> call : calls) {
            // searchQuietly catches everything the tier throws
            lists.add(call.exceptionally(ex -> {
                log.warn("Search call could not run", ex);
                return List.of();
            }).join());
        }
        return lists;
    }

    private static int countHits(final List<? extends List<?>> lists) {
        int hits = 0;
        for (final List<?> list : lists) {
            hits += list.size();
        }
        return hits;
    }
}
