package eu.virtualparadox.citeqa.rag.expand;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.answer.generation.ModelFallbackChain;
import eu.virtualparadox.citeqa.rag.llm.GenerationRequest;
import eu.virtualparadox.citeqa.rag.llm.GenerativeModelClient;
import eu.virtualparadox.citeqa.rag.llm.ModelResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the model for alternative phrasings of a query.
 * <p>
 * The original query is always the first variant. Expansion failures are never fatal: the
 * result then holds the original query only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryExpander {

    public static final String OPERATION = "query_expansion";

    private static final double TEMPERATURE = 0.3;
    private static final int MAX_OUTPUT_TOKENS = 200;

    /** Leading bullets or numbering such as "-", "*", "1.", "2)". */
    private static final Pattern VARIANT_LINE = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])?\\s*(.+?)\\s*$");

    private final GenerativeModelClient modelClient;
    private final ModelFallbackChain fallbackChain;
    private final ApplicationConfig props;

    /**
     * @param query original user query
     * @return variants, original first, without duplicates
     */
    public List<String> expand(final String query) {
        log.info("Expanding query: {}", query);

        final GenerationRequest request = new GenerationRequest(
                expansionModel(),
                buildPrompt(query),
                TEMPERATURE,
                MAX_OUTPUT_TOKENS,
                OPERATION,
                null);

        try {
            final ModelResponse response = modelClient.generate(request);
            final List<String> variants = parseVariants(query, response.text());
            log.info("Generated {} query variations", variants.size() - 1);
            return variants;
        } catch (RuntimeException e) {
            log.warn("Query expansion failed, using original query only: {}", e.getMessage());
            return List.of(query);
        }
    }

    /**
     * One variant per non-empty line, list markers stripped. Lines equal to the original
     * (ignoring case) or to an earlier line are dropped.
     */
    static List<String> parseVariants(final String query, final String text) {
        final Set<String> seen = new LinkedHashSet<>();
        final List<String> variants = new ArrayList<>();
        variants.add(query);
        seen.add(query.trim().toLowerCase());

        for (final String line : StringUtils.defaultString(text).split("\\R")) {
            final Matcher matcher = VARIANT_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            final String variant = StringUtils.strip(matcher.group(1), "\"'");
            if (StringUtils.isBlank(variant)) {
                continue;
            }
            if (seen.add(variant.toLowerCase())) {
                variants.add(variant);
            }
        }
        return variants;
    }

    private String expansionModel() {
        final String configured = props.getRetriever().getExpansionModel();
        return StringUtils.isBlank(configured) ? fallbackChain.primary() : configured;
    }

    private static String buildPrompt(final String query) {
        return String.join("\n",
                "Given this user query about terrorism financing, money laundering, or related topics,",
                "generate 2-3 alternative phrasings that would help retrieve relevant information.",
                "Focus on:",
                "- Expanding abbreviations (AML, CTF, FATF, etc.)",
                "- Adding synonyms",
                "- Rephrasing with domain terminology",
                "",
                "Original query: " + query,
                "",
                "Return ONLY the alternative queries, one per line, without numbering or explanation.");
    }
}
