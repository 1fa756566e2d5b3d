package eu.virtualparadox.citeqa.rag.rerank.service;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.answer.generation.ModelFallbackChain;
import eu.virtualparadox.citeqa.rag.llm.GenerationRequest;
import eu.virtualparadox.citeqa.rag.llm.GenerativeModelClient;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
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
 * Reranker asking a generative model for the relevance order of indexed snippets.
 * <p>
 * Steps:
 * <ol>
 *   <li>Render every item as {@code [i] snippet}, the snippet cut to the preview length</li>
 *   <li>Ask for the indices, most relevant first, comma-separated</li>
 *   <li>Keep in-range indices in the order seen, without repeats</li>
 *   <li>Append the indices the model left out in their original order</li>
 *   <li>Apply the cap</li>
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LlmRerankService implements RerankService {

    public static final String OPERATION = "rerank";

    private static final double TEMPERATURE = 0.1;
    private static final int MAX_OUTPUT_TOKENS = 100;
    private static final Pattern INDEX = Pattern.compile("\\d+");

    private final GenerativeModelClient modelClient;
    private final ModelFallbackChain fallbackChain;
    private final ApplicationConfig props;

    @Override
    public <T extends RetrievedItem> List<T> rerank(final String query, final List<T> items, final Integer topK) {
        if (items == null || items.size() < 2) {
            return items == null ? new ArrayList<>() : cap(items, topK);
        }

        log.info("Reranking {} results for query: {}", items.size(), query);
        try {
            final String text = modelClient.generate(new GenerationRequest(
                    rerankingModel(),
                    buildPrompt(query, items),
                    TEMPERATURE,
                    MAX_OUTPUT_TOKENS,
                    OPERATION,
                    null)).text();

            final List<Integer> order = parseOrder(text, items.size());
            final List<T> reranked = new ArrayList<>(items.size());
            for (final int index : order) {
                reranked.add(items.get(index));
            }
            log.info("Reranked results. New order: {}...", order.subList(0, Math.min(5, order.size())));
            return cap(reranked, topK);
        } catch (RuntimeException e) {
            log.warn("Reranking failed, keeping original order: {}", e.getMessage());
            return cap(items, topK);
        }
    }

    /**
     * Every index in {@code [0, size)} exactly once: the ones found in the text first.
     */
    static List<Integer> parseOrder(final String text, final int size) {
        final Set<Integer> order = new LinkedHashSet<>();
        final Matcher matcher = INDEX.matcher(StringUtils.defaultString(text));
        while (matcher.find()) {
            final String token = matcher.group();
            // longer tokens cannot be in range and would overflow
            if (token.length() > 9) {
                continue;
            }
            final int index = Integer.parseInt(token);
            if (index < size) {
                order.add(index);
            }
        }
        for (int i = 0; i < size; i++) {
            order.add(i);
        }
        return new ArrayList<>(order);
    }

    private String buildPrompt(final String query, final List<? extends RetrievedItem> items) {
        final int previewLength = props.getRetriever().getSnippetPreviewLength();
        final StringBuilder snippets = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            snippets.append('[').append(i).append("] ")
                    .append(StringUtils.left(items.get(i).text(), previewLength))
                    .append('\n');
        }

        return "Given this query: \"" + query + "\"\n\n"
                + "Rate the relevance of each document snippet from 0-10 (10 = most relevant).\n"
                + "Return ONLY the indices in order of relevance (most relevant first), comma-separated.\n\n"
                + "Snippets:\n"
                + snippets
                + "\nOrder (indices only, comma-separated):";
    }

    private String rerankingModel() {
        final String configured = props.getRetriever().getRerankingModel();
        return StringUtils.isBlank(configured) ? fallbackChain.primary() : configured;
    }

    private static <T> List<T> cap(final List<T> items, final Integer topK) {
        if (topK == null || topK >= items.size()) {
            return new ArrayList<>(items);
        }
        return new ArrayList<>(items.subList(0, Math.max(0, topK)));
    }
}
