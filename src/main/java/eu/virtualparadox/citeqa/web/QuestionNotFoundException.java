package eu.virtualparadox.citeqa.web;

public class QuestionNotFoundException extends RuntimeException {

    public QuestionNotFoundException(final long id) {
        super("No question job with id " + id);
    }
}
