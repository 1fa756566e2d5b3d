package eu.virtualparadox.citeqa.query.citation;

import eu.virtualparadox.citeqa.rag.answer.prompt.PromptAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites placeholder labels and collects the inline citations of an answer.
 * <p>
 * {@code Document n} and {@code Chunk n} become the title of the n-th summary or excerpt of the
 * prompt; a label without a target stays as written. Every bracketed span shorter than
 * {@value #MAX_CITATION_LENGTH} characters is a citation.
 */
@Component
@Slf4j
public class CitationExtractor {

    static final int MAX_CITATION_LENGTH = 200;

    private static final Pattern PLACEHOLDER_LABEL = Pattern.compile("\\b(Document|Chunk)\\s+(\\d{1,6})\\b");
    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\[\\]\\r\\n]+)]");

    public ExtractedCitations extract(final String rawAnswer, final SourceAttribution attribution) {
        final String fullAnswer = normalizeLabels(rawAnswer, attribution.documentLabels(), attribution.chunkLabels());
        final List<String> citations = findCitations(fullAnswer);
        log.info("Parsed {} explicit citations", citations.size());
        return new ExtractedCitations(mainAnswer(fullAnswer), fullAnswer, citations);
    }

    public String normalizeLabels(final String text,
                                  final Map<Integer, String> documentLabels,
                                  final Map<Integer, String> chunkLabels) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        final Matcher matcher = PLACEHOLDER_LABEL.matcher(text);
        final StringBuilder rewritten = new StringBuilder(text.length());
        while (matcher.find()) {
            final Map<Integer, String> labels = "Document".equals(matcher.group(1)) ? documentLabels : chunkLabels;
            final String title = labels.get(Integer.parseInt(matcher.group(2)));
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(title == null ? matcher.group() : title));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }

    public List<String> findCitations(final String text) {
        final Set<String> citations = new LinkedHashSet<>();
        if (text == null) {
            return new ArrayList<>();
        }

        final Matcher matcher = BRACKETED.matcher(text);
        while (matcher.find()) {
            final String citation = matcher.group(1).trim();
            if (!citation.isEmpty() && citation.length() < MAX_CITATION_LENGTH) {
                citations.add(citation);
            }
        }
        return new ArrayList<>(citations);
    }

    /**
     * Text before the citation section marker, or the whole text without one.
     */
    static String mainAnswer(final String fullAnswer) {
        final int marker = fullAnswer.indexOf(PromptAssembler.CITATIONS_MARKER);
        return marker < 0 ? fullAnswer.trim() : fullAnswer.substring(0, marker).trim();
    }
}
