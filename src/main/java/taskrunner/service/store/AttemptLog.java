package taskrunner.service.store;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only log of attempt starts.
 *
 * Appends from concurrent callers end up in one total order. Appending is best-effort:
 * the returned future always completes normally, write errors are only logged.
 */
public interface AttemptLog extends AutoCloseable {

    /**
     * Append one entry.
     *
     * @return completes once the entry has been written (or the write has failed)
     */
    CompletableFuture<Void> append(Entry entry);

    @Override
    void close();

    /** A log sink that drops everything */
    static AttemptLog discarding() {
        return new AttemptLog() {
            @Override
            public CompletableFuture<Void> append(Entry entry) {
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * One attempt start.
     */
    record Entry(Instant timestamp, String workerId, String taskId, int attempt, String message) {

        /**
         * {@code <ISO-8601> | worker-<id> | task-<id> | attempt-<n> | <message>\n}.
         * Line breaks inside the message are escaped.
         */
        public String toLine() {
            return timestamp + " | worker-" + workerId + " | task-" + taskId + " | attempt-" + attempt
                    + " | " + escape(message) + "\n";
        }

        private static String escape(String s) {
            if (s == null)
                return "";
            return s.replace("\r", "\\r").replace("\n", "\\n");
        }
    }
}
