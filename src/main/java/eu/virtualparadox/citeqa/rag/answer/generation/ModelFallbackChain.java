package eu.virtualparadox.citeqa.rag.answer.generation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable list of candidate models: the primary first, then the fallbacks.
 */
public record ModelFallbackChain(List<String> models) {

    public ModelFallbackChain {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("At least one model must be configured");
        }
        models = List.copyOf(models);
    }

    /**
     * Builds a chain dropping blank and repeated entries while keeping their order.
     *
     * @throws IllegalArgumentException if no usable model name remains
     */
    public static ModelFallbackChain of(final String primary, final List<String> fallbacks) {
        final Set<String> ordered = new LinkedHashSet<>();
        if (primary != null && !primary.isBlank()) {
            ordered.add(primary.trim());
        }
        if (fallbacks != null) {
            for (final String fallback : fallbacks) {
                if (fallback != null && !fallback.isBlank()) {
                    ordered.add(fallback.trim());
                }
            }
        }
        return new ModelFallbackChain(new ArrayList<>(ordered));
    }

    public String primary() {
        return models.get(0);
    }

    public FallbackChainRun start() {
        return new FallbackChainRun(models);
    }
}
