package eu.virtualparadox.citeqa.rag.retriever.analysis;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig.EFilterLogic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns filter hints into a filter expression of the search tiers, e.g.
 * <pre>
 *   organization:"FATF" OR tags:"sanctions"          (OR)
 *   (organization:"FATF") AND (tags:"sanctions")     (AND)
 * </pre>
 * With {@link EFilterLogic#AND} hints of the same kind stay alternatives; kinds are combined with AND.
 */
@Component
@Slf4j
public class MetadataFilterBuilder {

    /**
     * @return the filter expression, or {@code null} when there are no hints
     */
    public String build(final List<FilterHint> hints, final EFilterLogic logic) {
        if (hints == null || hints.isEmpty()) {
            return null;
        }

        final Map<EFilterHintKind, List<String>> clausesByKind = new LinkedHashMap<>();
        final List<String> allClauses = new ArrayList<>();
        for (final FilterHint hint : hints) {
            final String clause = hint.kind().field() + ":\"" + escape(hint.value()) + "\"";
            clausesByKind.computeIfAbsent(hint.kind(), k -> new ArrayList<>()).add(clause);
            allClauses.add(clause);
        }

        final String expression;
        if (logic == EFilterLogic.AND && clausesByKind.size() > 1) {
            final List<String> groups = new ArrayList<>();
            for (final List<String> clauses : clausesByKind.values()) {
                groups.add(String.join(" OR ", clauses));
            }
            expression = "(" + String.join(") AND (", groups) + ")";
        } else {
            expression = String.join(" OR ", allClauses);
        }

        log.info("Built metadata filter ({}): {}", logic, expression);
        return expression;
    }

    private static String escape(final String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
