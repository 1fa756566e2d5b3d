package eu.virtualparadox.citeqa.rag.retriever.fusion;

import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion over the ranked lists of one tier.
 * <p>
 * An item at 1-based rank {@code r} of a list contributes {@code 1 / (r + k)}. Contributions
 * are summed per identity key; the payload kept for a key is the first one encountered.
 * The result is ordered by descending score, ties in first-seen order.
 */
@Component
@Slf4j
public class ReciprocalRankFuser {

    public static final int DEFAULT_K = 60;

    /**
     * Fuses with the default constant {@value #DEFAULT_K}.
     */
    public <T extends RetrievedItem> List<T> fuse(final List<List<T>> rankedLists) {
        return fuse(rankedLists, DEFAULT_K);
    }

    /**
     * @param rankedLists one ranked list per query variant, best first; {@code null} lists are skipped
     * @param k           rank damping constant, must not be negative
     * @return fused items (never {@code null})
     */
    public <T extends RetrievedItem> List<T> fuse(final List<List<T>> rankedLists, final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        if (rankedLists == null || rankedLists.isEmpty()) {
            return new ArrayList<>();
        }

        final Map<String, FusedEntry<T>> entries = accumulate(rankedLists, k);
        final List<FusedEntry<T>> sorted = new ArrayList<>(entries.values());
        // List.sort is stable
        sorted.sort(Comparator.comparingDouble((FusedEntry<T> e) -> e.score).reversed());

        final List<T> fused = new ArrayList<>(sorted.size());
        for (final FusedEntry<T> entry : sorted) {
            fused.add(entry.item);
        }

        log.info("Merged {} ranked lists to {} unique results", rankedLists.size(), fused.size());
        return fused;
    }

    /**
     * Accumulated score of every identity key, in first-seen order.
     */
    public <T extends RetrievedItem> Map<String, Double> scores(final List<List<T>> rankedLists, final int k) {
        final Map<String, Double> scores = new LinkedHashMap<>();
        accumulate(rankedLists, k).forEach((key, entry) -> scores.put(key, entry.score));
        return scores;
    }

    private <T extends RetrievedItem> Map<String, FusedEntry<T>> accumulate(final List<List<T>> rankedLists,
                                                                           final int k) {
        // insertion order doubles as first-seen order for tie breaking
        final Map<String, FusedEntry<T>> entries = new LinkedHashMap<>();
        if (rankedLists == null) {
            return entries;
        }
        for (final List<T> rankedList : rankedLists) {
            if (rankedList == null) {
                continue;
            }
            int rank = 1;
            for (final T item : rankedList) {
                final double contribution = 1.0 / (rank + k);
                entries.computeIfAbsent(item.identityKey(), key -> new FusedEntry<>(item))
                        .add(contribution);
                rank++;
            }
        }
        return entries;
    }

    private static final class FusedEntry<T> {
        private final T item;
        private double score;

        private FusedEntry(final T item) {
            this.item = item;
        }

        private void add(final double contribution) {
            score += contribution;
        }
    }
}
