package eu.virtualparadox.citeqa.rag.answer.format;

/**
 * Expected answer length, with the number of explicit citations asked for.
 */
public enum ELengthClass {
    BRIEF(2),
    MEDIUM(3),
    LONG(5),
    COMPREHENSIVE(8);

    private final int minCitations;

    ELengthClass(final int minCitations) {
        this.minCitations = minCitations;
    }

    public int minCitations() {
        return minCitations;
    }
}
