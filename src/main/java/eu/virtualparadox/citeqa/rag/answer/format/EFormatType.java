package eu.virtualparadox.citeqa.rag.answer.format;

import static eu.virtualparadox.citeqa.rag.answer.format.ELengthClass.*;
import static eu.virtualparadox.citeqa.rag.answer.format.EStructureStyle.*;

/**
 * Answer formats with their fixed generation profile.
 */
public enum EFormatType {
    BRIEF_SUMMARY(BRIEF, BULLET_POINTS, 0.2, 512, "concise"),
    SOCIAL_MEDIA(BRIEF, SINGLE_PARAGRAPH, 0.5, 256, "engaging"),
    BLOG_POST(LONG, SECTIONS, 0.5, 3072, "conversational"),
    NEWSLETTER(MEDIUM, SECTIONS, 0.4, 2048, "informative"),
    OUTLINE(MEDIUM, HIERARCHICAL, 0.3, 1536, "structured"),
    PROTOCOL(MEDIUM, NUMBERED_STEPS, 0.15, 2048, "procedural"),
    COMPREHENSIVE_ANALYSIS(COMPREHENSIVE, SECTIONS, 0.35, 4096, "analytical"),
    REPORT(LONG, SECTIONS, 0.3, 3072, "formal"),
    FACTUAL_ANSWER(MEDIUM, PARAGRAPHS, 0.15, 1536, "precise"),
    GENERAL_ANSWER(MEDIUM, PARAGRAPHS, 0.2, 2048, "balanced");

    private final ELengthClass length;
    private final EStructureStyle structure;
    private final double temperature;
    private final int maxOutputTokens;
    private final String style;

    EFormatType(final ELengthClass length,
                final EStructureStyle structure,
                final double temperature,
                final int maxOutputTokens,
                final String style) {
        this.length = length;
        this.structure = structure;
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
        this.style = style;
    }

    public ELengthClass length() {
        return length;
    }

    public EStructureStyle structure() {
        return structure;
    }

    public double temperature() {
        return temperature;
    }

    public int maxOutputTokens() {
        return maxOutputTokens;
    }

    public String style() {
        return style;
    }
}
