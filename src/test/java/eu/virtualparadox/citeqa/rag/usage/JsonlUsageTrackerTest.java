package eu.virtualparadox.citeqa.rag.usage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonlUsageTracker}.
 */
class JsonlUsageTrackerTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Each attempt becomes one JSON line")
    void writesOneLinePerAttempt() throws Exception {
        final Path file = tempDir.resolve("usage.jsonl");
        try (JsonlUsageTracker tracker = new JsonlUsageTracker(file, objectMapper)) {
            tracker.record(attempt("a-1", EAttemptStatus.SUCCESS));
            tracker.record(attempt("a-2", EAttemptStatus.ERROR));
        }

        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);

        final JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.get("id").asText()).isEqualTo("a-1");
        assertThat(first.get("operation").asText()).isEqualTo("chat_answer");
        assertThat(first.get("totalTokens").asInt()).isEqualTo(15);
        assertThat(first.get("status").asText()).isEqualTo("SUCCESS");
        assertThat(objectMapper.readTree(lines.get(1)).get("status").asText()).isEqualTo("ERROR");
    }

    @Test
    @DisplayName("Concurrent writers never interleave lines")
    void concurrentWriters() throws Exception {
        final Path file = tempDir.resolve("concurrent.jsonl");
        final int writers = 8;
        final int perWriter = 50;

        try (JsonlUsageTracker tracker = new JsonlUsageTracker(file, objectMapper)) {
            final ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                final List<Future<?>> futures = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    final int writer = w;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < perWriter; i++) {
                            tracker.record(attempt(writer + "-" + i, EAttemptStatus.SUCCESS));
                        }
                    }));
                }
                for (final Future<?> future : futures) {
                    future.get();
                }
            } finally {
                pool.shutdown();
            }
        }

        final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(writers * perWriter);
        final Set<String> ids = new HashSet<>();
        for (final String line : lines) {
            ids.add(objectMapper.readTree(line).get("id").asText());
        }
        assertThat(ids).hasSize(writers * perWriter);
    }

    @Test
    @DisplayName("Records after close are dropped without failing")
    void recordAfterClose() throws Exception {
        final Path file = tempDir.resolve("closed.jsonl");
        final JsonlUsageTracker tracker = new JsonlUsageTracker(file, objectMapper);
        tracker.record(attempt("before", EAttemptStatus.SUCCESS));
        tracker.close();

        tracker.record(attempt("after", EAttemptStatus.SUCCESS));

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(1);
    }

    @Test
    @DisplayName("Unwritable target is logged, not thrown")
    void unwritableTarget() {
        final Path missingDir = tempDir.resolve("missing").resolve("usage.jsonl");
        try (JsonlUsageTracker tracker = new JsonlUsageTracker(missingDir, objectMapper)) {
            tracker.record(attempt("x", EAttemptStatus.SUCCESS));
        }
        assertThat(Files.exists(missingDir)).isFalse();
    }

    private static GenerationAttempt attempt(final String id, final EAttemptStatus status) {
        return GenerationAttempt.builder()
                .id(id)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .operation("chat_answer")
                .model("llama3.1:8b")
                .inputTokens(10)
                .outputTokens(5)
                .totalTokens(15)
                .latencyMs(12.5)
                .status(status)
                .build();
    }
}
