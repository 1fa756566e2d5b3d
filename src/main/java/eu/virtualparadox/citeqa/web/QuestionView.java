package eu.virtualparadox.citeqa.web;

import eu.virtualparadox.citeqa.query.AnswerResult;
import eu.virtualparadox.citeqa.query.question.EQuestionStatus;
import eu.virtualparadox.citeqa.query.question.QuestionJob;

import java.time.Instant;

public record QuestionView(long id,
                           String query,
                           EQuestionStatus status,
                           AnswerResult result,
                           String error,
                           Instant createdAt) {

    public static QuestionView of(final QuestionJob job) {
        return new QuestionView(job.getId(), job.getQuery(), job.getStatus(), job.getResult(), job.getError(), job.getCreatedAt());
    }
}
