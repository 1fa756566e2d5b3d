package eu.virtualparadox.citeqa.web;

import eu.virtualparadox.citeqa.query.AnswerRequest;
import eu.virtualparadox.citeqa.query.AnswerResult;
import eu.virtualparadox.citeqa.query.QueryManager;
import eu.virtualparadox.citeqa.query.question.QuestionJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point for questions: answered inline, or queued as a job to poll.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class AskController {

    private final QueryManager queryManager;

    @PostMapping("/answers")
    public AnswerResult answer(@RequestBody final AnswerRequest request) {
        log.info("Answering question: {}", request.query());
        return queryManager.answer(request);
    }

    @PostMapping("/questions")
    public ResponseEntity<QuestionView> submit(@RequestBody final AnswerRequest request) {
        final QuestionJob job = queryManager.submitQuery(request);
        log.info("Queued question job {}", job.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(QuestionView.of(job));
    }

    @GetMapping("/questions/{id}")
    public QuestionView question(@PathVariable("id") final long id) {
        return queryManager.getJob(id)
                .map(QuestionView::of)
                .orElseThrow(() -> new QuestionNotFoundException(id));
    }
}
