package eu.virtualparadox.citeqa.rag.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes one JSON object per line to a usage log file.
 * <p>
 * Each record is serialized outside the lock and appended (and flushed) under it, so lines
 * from concurrent writers never interleave. Created once per process; closed on shutdown.
 */
@Slf4j
public class JsonlUsageTracker implements UsageTracker, Closeable {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private BufferedWriter writer;
    private boolean closed;

    public JsonlUsageTracker(final Path file, final ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        log.info("Usage tracker initialized. Logging to: {}", file);
    }

    @Override
    public void record(final GenerationAttempt attempt) {
        final String line;
        try {
            line = objectMapper.writeValueAsString(attempt);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize usage record {}", attempt.id(), e);
            return;
        }

        lock.lock();
        try {
            if (closed) {
                log.warn("Usage tracker already closed, dropping record {}", attempt.id());
                return;
            }
            if (writer == null) {
                writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to write usage record {} to {}", attempt.id(), file, e);
        } finally {
            lock.unlock();
        }

        log.debug("Model call tracked: {} via {} ({} tokens, {} ms)",
                attempt.operation(), attempt.model(), attempt.totalTokens(), String.format("%.2f", attempt.latencyMs()));
    }

    /**
     * Flushes and closes the underlying file.
     */
    @Override
    @PreDestroy
    public void close() {
        lock.lock();
        try {
            closed = true;
            if (writer != null) {
                writer.flush();
                writer.close();
                writer = null;
            }
        } catch (IOException e) {
            log.error("Unable to close usage log {}", file, e);
        } finally {
            lock.unlock();
        }
    }
}
