package eu.virtualparadox.citeqa.rag.retriever.analysis;

public enum EQueryScope {
    NARROW,
    MEDIUM,
    BROAD
}
