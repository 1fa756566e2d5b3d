package eu.virtualparadox.citeqa.query.question;

import eu.virtualparadox.citeqa.query.AnswerRequest;
import eu.virtualparadox.citeqa.query.AnswerResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of background question jobs. Jobs live for the process lifetime.
 */
@Service
public class QuestionRegistry {

    private final AtomicLong counter;
    private final Map<Long, QuestionJob> jobs;

    public QuestionRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public QuestionJob createJob(final AnswerRequest request) {
        final long id = counter.incrementAndGet();
        final QuestionJob job = new QuestionJob(id, request);
        jobs.put(id, job);
        return job;
    }

    public Optional<QuestionJob> getJob(final long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void updateStatus(final long id, final EQuestionStatus status) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(status);
            return job;
        });
    }

    public void complete(final long id, final AnswerResult result) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setResult(result);
            job.setStatus(EQuestionStatus.COMPLETED);
            return job;
        });
    }

    public void fail(final long id, final String error) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setError(error);
            job.setStatus(EQuestionStatus.FAILED);
            return job;
        });
    }
}
