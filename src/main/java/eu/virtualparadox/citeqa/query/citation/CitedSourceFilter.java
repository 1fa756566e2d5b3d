package eu.virtualparadox.citeqa.query.citation;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the sources an answer actually cites: those whose title (ignoring case) or source id
 * occurs inside at least one citation. Without citations nothing is kept.
 */
@Component
public class CitedSourceFilter {

    public List<SourceRecord> filter(final List<SourceRecord> sources, final List<String> citations) {
        final List<SourceRecord> cited = new ArrayList<>();
        if (sources == null || citations == null || citations.isEmpty()) {
            return cited;
        }

        for (final SourceRecord source : sources) {
            if (isCited(source, citations)) {
                cited.add(source);
            }
        }
        return cited;
    }

    private static boolean isCited(final SourceRecord source, final List<String> citations) {
        for (final String citation : citations) {
            if (StringUtils.isNotBlank(source.getTitle()) && StringUtils.containsIgnoreCase(citation, source.getTitle())) {
                return true;
            }
            if (StringUtils.isNotBlank(source.getSourceId()) && citation.contains(source.getSourceId())) {
                return true;
            }
        }
        return false;
    }
}
