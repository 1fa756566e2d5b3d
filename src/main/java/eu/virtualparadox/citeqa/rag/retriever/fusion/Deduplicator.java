package eu.virtualparadox.citeqa.rag.retriever.fusion;

import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collapses items sharing an identity key, keeping the first occurrence.
 * <p>
 * Stateless and idempotent; the relative order of the survivors is the input order.
 */
@Component
@Slf4j
public class Deduplicator {

    /**
     * @param items items of a single tier; may be {@code null}
     * @return a new list without duplicate identity keys (never {@code null})
     */
    public <T extends RetrievedItem> List<T> deduplicate(final List<T> items) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }

        final Set<String> seenKeys = new HashSet<>();
        final List<T> unique = new ArrayList<>(items.size());
        for (final T item : items) {
            Objects.requireNonNull(item, "items must not contain null elements");
            if (seenKeys.add(item.identityKey())) {
                unique.add(item);
            }
        }

        final int removed = items.size() - unique.size();
        if (removed > 0) {
            log.info("Removed {} duplicate results", removed);
        }
        return unique;
    }
}
