package eu.virtualparadox.citeqa.rag.answer.format;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Infers the answer format from keywords of the query.
 * <p>
 * Rules are checked in a fixed order and the first match wins, so "brief tweet" is a
 * {@link EFormatType#BRIEF_SUMMARY}. Queries opening with a question word that no rule claims
 * are {@link EFormatType#FACTUAL_ANSWER}; everything else is {@link EFormatType#GENERAL_ANSWER}.
 */
@Component
@Slf4j
public class FormatClassifier {

    private record Rule(EFormatType formatType, Pattern pattern) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(EFormatType.BRIEF_SUMMARY,
                    keywords("brief", "summary", "summarize", "summarise", "tl;dr", "tldr", "in a nutshell")),
            new Rule(EFormatType.SOCIAL_MEDIA,
                    keywords("tweet", "twitter", "social media", "linkedin", "instagram", "facebook post")),
            new Rule(EFormatType.BLOG_POST,
                    keywords("blog", "blog post", "article", "op-ed")),
            new Rule(EFormatType.NEWSLETTER,
                    keywords("newsletter", "bulletin", "digest")),
            new Rule(EFormatType.OUTLINE,
                    keywords("outline", "presentation", "slides", "slide deck", "talking points")),
            new Rule(EFormatType.PROTOCOL,
                    keywords("protocol", "procedure", "procedures", "step-by-step", "step by step", "how to",
                            "checklist")),
            new Rule(EFormatType.COMPREHENSIVE_ANALYSIS,
                    keywords("comprehensive", "in-depth", "in depth", "thorough", "deep dive", "detailed analysis")),
            new Rule(EFormatType.REPORT,
                    keywords("report", "white paper")));

    private static final Pattern FACTUAL_START =
            Pattern.compile("^\\s*(what|who|when|where|which|define|is|are)\\b");

    /**
     * Pure function of the query text.
     */
    public FormatDecision classify(final String query) {
        final String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);

        EFormatType formatType = null;
        for (final Rule rule : RULES) {
            if (rule.pattern().matcher(lower).find()) {
                formatType = rule.formatType();
                break;
            }
        }
        if (formatType == null) {
            formatType = FACTUAL_START.matcher(lower).find() ? EFormatType.FACTUAL_ANSWER : EFormatType.GENERAL_ANSWER;
        }

        final FormatDecision decision = FormatDecision.of(formatType);
        log.info("Detected output format: {} (length={}, structure={}, temperature={})",
                formatType, decision.length(), decision.structure(), decision.temperature());
        return decision;
    }

    private static Pattern keywords(final String... keywords) {
        final StringBuilder alternatives = new StringBuilder();
        for (final String keyword : keywords) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(keyword));
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternatives + ")(?![\\p{L}\\p{N}])");
    }
}
