package taskrunner.service.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * File-backed attempt log.
 *
 * All writes go through a single writer thread, which gives appends from different
 * workers a FIFO total order and keeps lines from interleaving.
 */
public final class FileAttemptLog implements AttemptLog {

    private static final Logger log = LoggerFactory.getLogger(FileAttemptLog.class);

    private final Path path;
    private final ExecutorService writer;

    private FileAttemptLog(Path path) {
        this.path = path;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "attempt-log-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open the log, creating missing parent directories and writing a start marker.
     * Failures are logged; the log is still usable and will keep trying on every append.
     */
    public static FileAttemptLog open(Path path) {
        FileAttemptLog attemptLog = new FileAttemptLog(path);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            log.error("Could not create directory for attempt log {}", path, e);
        }
        attemptLog.appendLine("--- service start " + Instant.now() + " ---\n");
        log.info("Attempt log opened at {}", path.toAbsolutePath());
        return attemptLog;
    }

    public Path path() {
        return path;
    }

    @Override
    public CompletableFuture<Void> append(Entry entry) {
        return appendLine(entry.toLine());
    }

    private CompletableFuture<Void> appendLine(String line) {
        try {
            return CompletableFuture.runAsync(() -> write(line), writer);
        } catch (RejectedExecutionException e) {
            log.warn("Attempt log closed, dropping line: {}", line.stripTrailing());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void write(String line) {
        try {
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("log write error: {}", path, e);
        }
    }

    /**
     * Flush pending appends and stop the writer thread.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
                log.warn("Attempt log writer forcefully stopped");
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
