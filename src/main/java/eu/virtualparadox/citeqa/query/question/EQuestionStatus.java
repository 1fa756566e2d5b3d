package eu.virtualparadox.citeqa.query.question;

public enum EQuestionStatus {
    QUEUED,
    EXPANDING,
    RETRIEVING,
    RERANKING,
    ANSWERING,
    COMPLETED,
    FAILED
}
