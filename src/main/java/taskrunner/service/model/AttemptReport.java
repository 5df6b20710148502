package taskrunner.service.model;

/**
 * Outcome of a single attempt, sent by a worker exactly once per attempt it performed.
 */
public record AttemptReport(
        String taskId,
        String workerId,
        int attemptNumber,
        boolean success,
        long durationMs) {

    public static AttemptReport success(String taskId, String workerId, int attemptNumber, long durationMs) {
        return new AttemptReport(taskId, workerId, attemptNumber, true, durationMs);
    }

    public static AttemptReport failure(String taskId, String workerId, int attemptNumber, long durationMs) {
        return new AttemptReport(taskId, workerId, attemptNumber, false, durationMs);
    }
}
