package taskrunner.service.simulation;

/**
 * Executes one attempt of a task.
 * Implementations may block; they are always called from a worker thread.
 */
public interface TaskExecutor {

    /**
     * Run a single attempt.
     *
     * @param payload the task message
     * @return whether the attempt succeeded and how long it took
     * @throws InterruptedException if the worker is interrupted while the attempt runs
     * @throws Exception            on any unexpected fault, treated as a failed attempt
     */
    AttemptResult execute(String payload) throws Exception;

    /**
     * Result of one attempt.
     */
    record AttemptResult(boolean succeeded, long durationMs) {

        public static AttemptResult success(long durationMs) {
            return new AttemptResult(true, durationMs);
        }

        public static AttemptResult failure(long durationMs) {
            return new AttemptResult(false, durationMs);
        }
    }
}
