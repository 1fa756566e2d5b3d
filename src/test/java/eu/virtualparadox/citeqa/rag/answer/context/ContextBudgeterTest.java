package eu.virtualparadox.citeqa.rag.answer.context;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.citeqa.TestItems.excerpt;
import static eu.virtualparadox.citeqa.TestItems.summary;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ContextBudgeter}.
 */
class ContextBudgeterTest {

    private ApplicationConfig props;
    private ContextBudgeter budgeter;

    @BeforeEach
    void setUp() {
        props = new ApplicationConfig();
        budgeter = new ContextBudgeter(props);
    }

    @Test
    @DisplayName("Small context passes through untouched")
    void smallContextFits() {
        final List<SummaryItem> summaries = List.of(summary("s1", "doc1", "AML Handbook"));
        final List<ExcerptItem> excerpts = List.of(excerpt("e1", "doc1", "AML Handbook", 3));

        final BudgetedContext context = budgeter.fit(summaries, excerpts);

        assertThat(context.summaries()).containsExactlyElementsOf(summaries);
        assertThat(context.excerpts()).containsExactlyElementsOf(excerpts);
        assertThat(context.truncated()).isFalse();
        assertThat(context.availableTokens()).isEqualTo(22_000);
    }

    @Test
    @DisplayName("Long lists never exceed the budget")
    void longListsStayWithinBudget() {
        final List<SummaryItem> summaries = new ArrayList<>();
        final List<ExcerptItem> excerpts = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            summaries.add(summary("s" + i, "doc" + i, "Doc " + i, "s".repeat(3_001 + i)));
            excerpts.add(excerpt("e" + i, "doc" + i, "Doc " + i, "e".repeat(4_000 + 7 * i)));
        }

        final BudgetedContext context = budgeter.fit(summaries, excerpts);

        assertThat(context.truncated()).isTrue();
        assertThat(context.usedTokens()).isLessThanOrEqualTo(context.availableTokens());
        assertThat(estimate(context)).isLessThanOrEqualTo(context.availableTokens());
        assertThat(context.excerpts().get(context.excerpts().size() - 1).content()).endsWith("...");
    }

    @Test
    @DisplayName("First item that does not fit is shortened when the remaining space is useful")
    void partialItemIsShortened() {
        final List<ExcerptItem> excerpts = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            excerpts.add(excerpt("e" + i, "doc" + i, "Doc " + i, "x".repeat(4_000)));
        }

        final BudgetedContext context = budgeter.fit(List.of(), excerpts);

        // 17 600 excerpt tokens: 17 whole excerpts plus 600 tokens of the 18th
        assertThat(context.excerpts()).hasSize(18);
        assertThat(context.excerpts().get(17).content()).hasSize(2_400).endsWith("...");
        assertThat(context.excerptTokens()).isEqualTo(17_600);
    }

    @Test
    @DisplayName("A shortened summary keeps its metadata")
    void partialSummaryKeepsMetadata() {
        final List<SummaryItem> summaries = List.of(
                summary("s1", "doc1", "First", "a".repeat(12_000)),
                summary("s2", "doc2", "Second", "b".repeat(12_000)));

        final BudgetedContext context = budgeter.fit(summaries, List.of());

        // 4 400 summary tokens: one whole summary plus 1 400 tokens of the second
        assertThat(context.summaries()).hasSize(2);
        final SummaryItem shortened = context.summaries().get(1);
        assertThat(shortened.summaryText()).hasSize(5_600).endsWith("...");
        assertThat(shortened.id()).isEqualTo("s2");
        assertThat(shortened.author()).isEqualTo("Jane Analyst");
        assertThat(shortened.tags()).containsExactly("aml");
        assertThat(context.summaryTokens()).isEqualTo(4_400);
    }

    @Test
    @DisplayName("Remaining space below the useful minimum drops the item")
    void tooLittleSpaceDropsItem() {
        final List<ExcerptItem> excerpts = List.of(
                excerpt("e1", "doc1", "Doc", "x".repeat(4_000)),
                excerpt("e2", "doc2", "Doc", "x".repeat(4_000)),
                excerpt("e3", "doc3", "Doc", "x".repeat(4_000)));

        // 2 625 available, 2 100 for excerpts: two fit and 100 tokens remain
        final BudgetedContext context = budgeter.fit(List.of(), excerpts, 4_625);

        assertThat(context.excerpts()).extracting(ExcerptItem::id).containsExactly("e1", "e2");
        assertThat(context.truncated()).isTrue();
    }

    @Test
    @DisplayName("Disabled truncation keeps everything")
    void truncationDisabled() {
        props.getSynthesizer().setContextTruncationEnabled(false);
        final List<ExcerptItem> excerpts = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            excerpts.add(excerpt("e" + i, "doc" + i, "Doc " + i, "x".repeat(4_000)));
        }

        final BudgetedContext context = budgeter.fit(List.of(), excerpts);

        assertThat(context.excerpts()).hasSize(50);
        assertThat(context.truncated()).isFalse();
    }

    private static int estimate(final BudgetedContext context) {
        int tokens = 0;
        for (final SummaryItem s : context.summaries()) {
            tokens += TokenEstimator.estimate(s.text());
        }
        for (final ExcerptItem e : context.excerpts()) {
            tokens += TokenEstimator.estimate(e.text());
        }
        return tokens;
    }
}
