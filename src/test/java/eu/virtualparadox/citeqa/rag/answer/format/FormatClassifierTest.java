package eu.virtualparadox.citeqa.rag.answer.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link FormatClassifier}.
 */
class FormatClassifierTest {

    private final FormatClassifier classifier = new FormatClassifier();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Give me a brief overview of FATF recommendations | BRIEF_SUMMARY",
            "Write a tweet about terrorist financing trends | SOCIAL_MEDIA",
            "Draft a blog post on sanctions evasion | BLOG_POST",
            "Prepare the monthly newsletter on AML typologies | NEWSLETTER",
            "Create an outline for a presentation on KYC | OUTLINE",
            "What is the procedure for filing a SAR? | PROTOCOL",
            "Give me a comprehensive analysis of trade-based laundering | COMPREHENSIVE_ANALYSIS",
            "Write a report on crypto mixers | REPORT",
            "What is CENTEF? | FACTUAL_ANSWER",
            "Tell me about hawala networks | GENERAL_ANSWER"
    })
    void classifiesByKeyword(final String query, final EFormatType expected) {
        assertEquals(expected, classifier.classify(query).formatType());
    }

    @Test
    @DisplayName("Rule order decides between competing keywords")
    void ruleOrderWins() {
        assertEquals(EFormatType.BRIEF_SUMMARY, classifier.classify("brief tweet").formatType());
    }

    @Test
    @DisplayName("Keywords match whole words only")
    void wholeWordsOnly() {
        assertEquals(EFormatType.GENERAL_ANSWER, classifier.classify("Explain reporting thresholds for casinos").formatType());
    }

    @Test
    @DisplayName("Same query yields the same decision")
    void deterministic() {
        final String query = "Summarize the 2023 mutual evaluation of Germany";
        assertEquals(classifier.classify(query), classifier.classify(query));
    }

    @Test
    @DisplayName("Decision carries the profile of its format")
    void decisionCarriesProfile() {
        final FormatDecision decision = classifier.classify("Write a tweet on PEP screening");
        assertEquals(ELengthClass.BRIEF, decision.length());
        assertEquals(EStructureStyle.SINGLE_PARAGRAPH, decision.structure());
        assertEquals(0.5, decision.temperature());
        assertEquals(256, decision.maxOutputTokens());
        assertEquals(2, decision.minCitations());
        assertEquals(0.1, decision.withTemperature(0.1).temperature());
    }
}
