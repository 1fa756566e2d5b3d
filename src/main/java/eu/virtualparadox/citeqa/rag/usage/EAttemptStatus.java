package eu.virtualparadox.citeqa.rag.usage;

public enum EAttemptStatus {
    SUCCESS,
    ERROR
}
