package eu.virtualparadox.citeqa.query.citation;

import java.util.List;

/**
 * @param mainAnswer answer body, without the trailing citation section
 * @param fullAnswer complete answer with placeholder labels replaced
 * @param citations  distinct bracketed references, first-seen order, brackets removed
 */
public record ExtractedCitations(String mainAnswer, String fullAnswer, List<String> citations) {

    public ExtractedCitations {
        citations = List.copyOf(citations);
    }
}
