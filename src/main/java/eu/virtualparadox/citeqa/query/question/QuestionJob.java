package eu.virtualparadox.citeqa.query.question;

import eu.virtualparadox.citeqa.query.AnswerRequest;
import eu.virtualparadox.citeqa.query.AnswerResult;

import java.time.Instant;

public class QuestionJob {
    private final long id;
    private final AnswerRequest request;
    private volatile EQuestionStatus status;
    private volatile AnswerResult result;
    private volatile String error;
    private final Instant createdAt;

    public QuestionJob(final long id, final AnswerRequest request) {
        this.id = id;
        this.request = request;
        this.status = EQuestionStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public AnswerRequest getRequest() { return request; }
    public String getQuery() { return request.query(); }
    public EQuestionStatus getStatus() { return status; }
    public AnswerResult getResult() { return result; }
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }

    void setStatus(final EQuestionStatus status) { this.status = status; }
    void setResult(final AnswerResult result) { this.result = result; }
    void setError(final String error) { this.error = error; }
}
