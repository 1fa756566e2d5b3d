package eu.virtualparadox.citeqa.rag.retriever.analysis;

public enum EQueryComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX
}
