package eu.virtualparadox.citeqa.query.citation.pageinterval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Collapses page numbers into compact ranges.
 *
 * <h2>Example</h2>
 * Input:
 * <pre>
 *   [1, 2, 3, 5, 6, 10]
 * </pre>
 * Output:
 * <pre>
 *   "1-3, 5-6, 10"
 * </pre>
 */
public final class PageRangeFormatter {

    private PageRangeFormatter() {
        // prevent instantiation
    }

    /**
     * @param pages page numbers in any order, repeats allowed; may be {@code null}
     * @return sorted runs of consecutive pages (never {@code null})
     */
    public static List<PageInterval> toIntervals(final Collection<Integer> pages) {
        final List<PageInterval> intervals = new ArrayList<>();
        if (pages == null || pages.isEmpty()) {
            return intervals;
        }

        final TreeSet<Integer> sorted = new TreeSet<>();
        for (final Integer page : pages) {
            sorted.add(Objects.requireNonNull(page, "pages must not contain null elements"));
        }

        int start = sorted.first();
        int previous = start;
        for (final int page : sorted.tailSet(start, false)) {
            if (page != previous + 1) {
                intervals.add(new PageInterval(start, previous));
                start = page;
            }
            previous = page;
        }
        intervals.add(new PageInterval(start, previous));
        return intervals;
    }

    /**
     * @return runs joined by {@code ", "}; empty string for no pages
     */
    public static String format(final Collection<Integer> pages) {
        final List<String> parts = new ArrayList<>();
        for (final PageInterval interval : toIntervals(pages)) {
            parts.add(interval.asString());
        }
        return String.join(", ", parts);
    }
}
