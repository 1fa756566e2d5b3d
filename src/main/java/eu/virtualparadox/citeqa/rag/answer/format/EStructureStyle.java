package eu.virtualparadox.citeqa.rag.answer.format;

public enum EStructureStyle {
    BULLET_POINTS,
    SINGLE_PARAGRAPH,
    PARAGRAPHS,
    SECTIONS,
    NUMBERED_STEPS,
    HIERARCHICAL
}
