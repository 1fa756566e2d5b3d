package eu.virtualparadox.citeqa.query.citation;

import java.util.List;
import java.util.Map;

/**
 * @param sources        one finished record per distinct source id, in first-seen order
 * @param documentLabels resolved title of the n-th summary of the prompt (1-based)
 * @param chunkLabels    resolved title of the n-th excerpt of the prompt (1-based)
 */
public record SourceAttribution(List<SourceRecord> sources,
                                Map<Integer, String> documentLabels,
                                Map<Integer, String> chunkLabels) {

    public SourceAttribution {
        sources = List.copyOf(sources);
        documentLabels = Map.copyOf(documentLabels);
        chunkLabels = Map.copyOf(chunkLabels);
    }
}
