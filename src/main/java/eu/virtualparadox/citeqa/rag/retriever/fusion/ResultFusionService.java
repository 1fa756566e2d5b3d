package eu.virtualparadox.citeqa.rag.retriever.fusion;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.model.TwoTierRetrieval;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses the per-variant lists of each tier into one list.
 * <p>
 * With several variants the lists are merged with {@link ReciprocalRankFuser}; with a single
 * variant its list is taken as is. Deduplication runs afterwards when enabled.
 */
@Service
@RequiredArgsConstructor
public class ResultFusionService {

    private final ReciprocalRankFuser fuser;
    private final Deduplicator deduplicator;
    private final ApplicationConfig props;

    public FusedRetrieval fuse(final TwoTierRetrieval retrieval) {
        return new FusedRetrieval(
                fuseTier(retrieval.excerptLists()),
                fuseTier(retrieval.summaryLists()));
    }

    private <T extends RetrievedItem> List<T> fuseTier(final List<List<T>> rankedLists) {
        final List<T> merged;
        if (rankedLists.size() > 1) {
            merged = fuser.fuse(rankedLists, props.getRetriever().getRrfK());
        } else if (rankedLists.size() == 1) {
            merged = new ArrayList<>(rankedLists.get(0));
        } else {
            merged = new ArrayList<>();
        }

        if (props.getRetriever().isDeduplicationEnabled()) {
            return deduplicator.deduplicate(merged);
        }
        return merged;
    }
}
