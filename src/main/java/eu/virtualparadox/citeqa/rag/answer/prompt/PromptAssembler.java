package eu.virtualparadox.citeqa.rag.answer.prompt;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.query.history.ConversationTurn;
import eu.virtualparadox.citeqa.rag.answer.context.BudgetedContext;
import eu.virtualparadox.citeqa.rag.answer.format.FormatDecision;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import eu.virtualparadox.citeqa.util.TimestampFormatter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the generation prompt.
 * <p>
 * Sections, in order:
 * <ol>
 *   <li>Role and domain context</li>
 *   <li>Prior conversation, oldest turn first (only when there is one)</li>
 *   <li>Format instructions derived from the {@link FormatDecision}</li>
 *   <li>Citation requirements, scaled by the length class</li>
 *   <li>The user question</li>
 *   <li>Summaries as {@code [Document i]} and excerpts as {@code [Chunk i]}, numbered from 1</li>
 * </ol>
 * The output only depends on the arguments.
 */
@Component
@RequiredArgsConstructor
public class PromptAssembler {

    public static final String CITATIONS_MARKER = "---CITATIONS---";

    private static final String RULE = "=".repeat(80);

    private final ApplicationConfig props;

    public String assemble(final String query,
                           final FormatDecision format,
                           final BudgetedContext context,
                           final List<ConversationTurn> history) {
        final boolean prioritizeCitations = props.getSynthesizer().isCitationsPrioritized();
        final List<String> parts = new ArrayList<>();

        parts.add("You are an expert assistant for a knowledge base on terrorism financing and money laundering.");
        parts.add("Your role is to provide accurate answers based on the provided documents.");
        parts.add("");
        parts.add("DOMAIN CONTEXT:");
        parts.add("- AML = Anti-Money Laundering");
        parts.add("- CTF/CFT = Counter-Terrorism Financing");
        parts.add("- FATF = Financial Action Task Force");
        parts.add("- PEP = Politically Exposed Person");
        parts.add("- SAR = Suspicious Activity Report");
        parts.add("- KYC = Know Your Customer");
        parts.add("");

        appendHistory(parts, history);
        appendFormatInstructions(parts, format);

        if (prioritizeCitations) {
            parts.add("CITATION REQUIREMENTS:");
            parts.add("1. You MUST cite sources for ALL factual claims");
            parts.add("2. Use format: [Document Title, Page X] or [Document Title] for summaries");
            parts.add("3. Include AT LEAST " + format.minCitations() + " explicit citations throughout your answer");
            parts.add("4. Place citations immediately after the relevant claim");
            parts.add("5. End with '" + CITATIONS_MARKER + "' section listing all cited sources");
            parts.add("");
        }

        parts.add("USER QUESTION: " + query);
        parts.add("");

        appendSummaries(parts, context.summaries());
        appendExcerpts(parts, context.excerpts());

        if (prioritizeCitations) {
            parts.add("");
            parts.add(RULE);
            parts.add("REQUIRED OUTPUT FORMAT:");
            parts.add(RULE);
            parts.add("1. Answer with inline citations [Document Title, Page X]");
            parts.add("2. Include AT LEAST " + format.minCitations() + " citations");
            parts.add("3. End with:");
            parts.add(CITATIONS_MARKER);
            parts.add("CITED: [List each source cited, format: Title (Page X) or (Summary)]");
            parts.add("");
        }

        return String.join("\n", parts);
    }

    private void appendHistory(final List<String> parts, final List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return;
        }
        parts.add("PREVIOUS CONVERSATION:");
        for (final ConversationTurn turn : history) {
            if (turn == null || StringUtils.isBlank(turn.content())) {
                continue;
            }
            parts.add(roleLabel(turn.role()) + ": " + turn.content().trim());
        }
        parts.add("");
    }

    private void appendFormatInstructions(final List<String> parts, final FormatDecision format) {
        parts.add("OUTPUT FORMAT: " + format.formatType().name().toLowerCase(Locale.ROOT)
                + " (" + format.style() + " style)");
        switch (format.formatType()) {
            case BRIEF_SUMMARY -> {
                parts.add("- Give a brief summary of 3 to 5 bullet points");
                parts.add("- One sentence per bullet, no introduction");
            }
            case SOCIAL_MEDIA -> {
                parts.add("- Write a single engaging paragraph suitable for a social media post");
                parts.add("- Stay under 280 characters of prose, citations excluded");
            }
            case BLOG_POST -> {
                parts.add("- Write a blog post with a title, an introduction, headed sections and a conclusion");
                parts.add("- Use a conversational but accurate tone");
            }
            case NEWSLETTER -> {
                parts.add("- Write a newsletter item with a headline and short headed sections");
                parts.add("- Highlight what is new or changed");
            }
            case OUTLINE -> {
                parts.add("- Produce a hierarchical outline with numbered main points and nested sub-points");
                parts.add("- Keep each point to a short phrase");
            }
            case PROTOCOL -> {
                parts.add("- Present the answer as numbered, actionable steps in execution order");
                parts.add("- Mention responsible parties and required documentation where the sources do");
            }
            case COMPREHENSIVE_ANALYSIS -> {
                parts.add("- Provide an in-depth analysis with headed sections: background, analysis, implications, conclusion");
                parts.add("- Synthesize across sources and point out disagreements between them");
            }
            case REPORT -> {
                parts.add("- Write a formal report: executive summary, findings in headed sections, recommendations");
                parts.add("- Be specific with numbers, dates and examples from the sources");
            }
            case FACTUAL_ANSWER -> {
                parts.add("- Answer the question directly in the first sentence, then add supporting paragraphs");
                parts.add("- Stick to facts stated in the sources");
            }
            default -> {
                parts.add("- Answer in clear paragraphs, synthesizing information across sources");
                parts.add("- Expand abbreviations on first use");
            }
        }
        parts.add("");
    }

    private void appendSummaries(final List<String> parts, final List<SummaryItem> summaries) {
        parts.add(RULE);
        parts.add("DOCUMENT SUMMARIES:");
        parts.add(RULE);

        if (summaries.isEmpty()) {
            parts.add("(No document summaries available)");
            return;
        }

        for (int i = 0; i < summaries.size(); i++) {
            final SummaryItem summary = summaries.get(i);
            parts.add("");
            parts.add("[Document " + (i + 1) + "] " + displayTitle(summary.title()));

            final List<String> metadata = new ArrayList<>(3);
            if (StringUtils.isNotBlank(summary.author())) {
                metadata.add("Author: " + summary.author());
            }
            if (StringUtils.isNotBlank(summary.organization())) {
                metadata.add("Org: " + summary.organization());
            }
            if (StringUtils.isNotBlank(summary.date())) {
                metadata.add("Date: " + summary.date());
            }
            if (!metadata.isEmpty()) {
                parts.add(String.join(" | ", metadata));
            }

            parts.add("");
            parts.add(summary.text());
        }
    }

    private void appendExcerpts(final List<String> parts, final List<ExcerptItem> excerpts) {
        parts.add("");
        parts.add(RULE);
        parts.add("DETAILED CONTENT CHUNKS:");
        parts.add(RULE);

        if (excerpts.isEmpty()) {
            parts.add("(No detailed chunks available)");
            return;
        }

        for (int i = 0; i < excerpts.size(); i++) {
            final ExcerptItem excerpt = excerpts.get(i);
            parts.add("");
            parts.add("[Chunk " + (i + 1) + "] " + displayTitle(excerpt.title()));

            final List<String> location = new ArrayList<>(2);
            if (StringUtils.isNotBlank(excerpt.filename())) {
                location.add(excerpt.filename());
            }
            if (excerpt.hasPage()) {
                location.add("Page " + excerpt.page());
            } else if (excerpt.hasTimeRange()) {
                final double end = excerpt.endSec() == null ? excerpt.startSec() : excerpt.endSec();
                location.add("Time: " + TimestampFormatter.format(excerpt.startSec()) + "-" + TimestampFormatter.format(end));
            }
            if (!location.isEmpty()) {
                parts.add(String.join(" | ", location));
            }

            parts.add("");
            parts.add(excerpt.text());
        }
    }

    private static String displayTitle(final String title) {
        return StringUtils.isBlank(title) ? "Unknown" : title;
    }

    private static String roleLabel(final String role) {
        if ("assistant".equalsIgnoreCase(role)) {
            return "Assistant";
        }
        if ("user".equalsIgnoreCase(role)) {
            return "User";
        }
        return StringUtils.capitalize(StringUtils.defaultIfBlank(role, "user").toLowerCase(Locale.ROOT));
    }
}
