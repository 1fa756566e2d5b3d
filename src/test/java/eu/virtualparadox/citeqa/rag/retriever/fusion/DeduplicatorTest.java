package eu.virtualparadox.citeqa.rag.retriever.fusion;

import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static eu.virtualparadox.citeqa.TestItems.excerpt;
import static eu.virtualparadox.citeqa.TestItems.summary;
import static eu.virtualparadox.citeqa.TestItems.timedExcerpt;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Deduplicator}.
 */
class DeduplicatorTest {

    private final Deduplicator deduplicator = new Deduplicator();

    @Test
    @DisplayName("Null and empty input yield an empty list")
    void testNullAndEmpty() {
        assertTrue(deduplicator.deduplicate(null).isEmpty());
        assertTrue(deduplicator.deduplicate(new ArrayList<ExcerptItem>()).isEmpty());
    }

    @Test
    @DisplayName("Excerpts of the same source and page collapse to the first occurrence")
    void testSamePageCollapses() {
        final ExcerptItem first = excerpt("a", "doc1", "AML Handbook", 3);
        final ExcerptItem second = excerpt("b", "doc1", "AML Handbook", 3);
        final ExcerptItem otherPage = excerpt("c", "doc1", "AML Handbook", 4);

        final List<ExcerptItem> result = deduplicator.deduplicate(List.of(first, otherPage, second));

        assertEquals(List.of(first, otherPage), result);
    }

    @Test
    @DisplayName("Excerpts of the same media source differ by start time")
    void testTimeAnchors() {
        final ExcerptItem a = timedExcerpt("a", "vid", "Briefing", 10.0, 20.0);
        final ExcerptItem b = timedExcerpt("b", "vid", "Briefing", 10.0, 25.0);
        final ExcerptItem c = timedExcerpt("c", "vid", "Briefing", 30.0, 40.0);

        assertEquals(List.of(a, c), deduplicator.deduplicate(List.of(a, b, c)));
    }

    @Test
    @DisplayName("Summaries are unique per source")
    void testSummariesBySource() {
        final SummaryItem a = summary("s1", "doc1", "AML Handbook");
        final SummaryItem b = summary("s2", "doc1", "AML Handbook");
        final SummaryItem c = summary("s3", "doc2", "CTF Guide");

        assertEquals(List.of(a, c), deduplicator.deduplicate(List.of(a, b, c)));
    }

    @Test
    @DisplayName("Items without a source fall back to their own id")
    void testMissingSourceFallsBackToId() {
        final ExcerptItem a = excerpt("a", null, "x", 1);
        final ExcerptItem b = excerpt("b", null, "x", 1);
        final ExcerptItem a2 = excerpt("a", " ", "x", 2);

        assertEquals(List.of(a, b), deduplicator.deduplicate(List.of(a, b, a2)));
    }

    @Test
    @DisplayName("Deduplication is idempotent")
    void testIdempotent() {
        final List<ExcerptItem> input = Arrays.asList(
                excerpt("a", "doc1", "t", 1),
                excerpt("b", "doc2", "t", 1),
                excerpt("c", "doc1", "t", 1),
                excerpt("d", "doc2", "t", 2),
                excerpt("e", "doc2", "t", 1));

        final List<ExcerptItem> once = deduplicator.deduplicate(input);
        assertEquals(once, deduplicator.deduplicate(once));
        assertEquals(3, once.size());
    }

    @Test
    @DisplayName("Null elements are rejected")
    void testNullElement() {
        final List<ExcerptItem> input = Arrays.asList(excerpt("a", "doc1", "t", 1), null);
        assertThrows(NullPointerException.class, () -> deduplicator.deduplicate(input));
    }
}
