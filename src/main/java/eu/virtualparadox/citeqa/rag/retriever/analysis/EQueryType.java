package eu.virtualparadox.citeqa.rag.retriever.analysis;

public enum EQueryType {
    FACTUAL,
    COMPARATIVE,
    PROCEDURAL,
    ANALYTICAL,
    EXPLORATORY
}
