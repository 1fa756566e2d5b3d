package eu.virtualparadox.citeqa.rag.llm;

public enum EModelErrorClass {
    RATE_LIMITED,
    QUOTA_EXCEEDED,
    OTHER;

    public boolean isCapacityProblem() {
        return this == RATE_LIMITED || this == QUOTA_EXCEEDED;
    }
}
