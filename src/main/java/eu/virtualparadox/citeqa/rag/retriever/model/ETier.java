package eu.virtualparadox.citeqa.rag.retriever.model;

public enum ETier {
    EXCERPT,
    SUMMARY
}
