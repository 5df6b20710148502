package taskrunner.service.dispatch;

import taskrunner.service.model.StatisticsSnapshot;

/**
 * Running counters behind the statistics endpoint.
 *
 * Not thread-safe: only mutated and read by {@link TaskDispatcher} while it holds its lock.
 * All counters only grow; the snapshot is derived from them, never from task history.
 */
final class DispatchCounters {

    private long processedTasks;
    private long retries;
    private long succeeded;
    private long failed;
    private long attempts;
    private long totalProcessingTimeMs;

    void recordAttempt(long durationMs) {
        attempts++;
        totalProcessingTimeMs += Math.max(0L, durationMs);
    }

    void recordSuccess() {
        succeeded++;
        processedTasks++;
    }

    void recordFailure() {
        failed++;
        processedTasks++;
    }

    void recordRetry() {
        retries++;
    }

    long attempts() {
        return attempts;
    }

    StatisticsSnapshot snapshot(int queueLength, int idleWorkers, int busyWorkers) {
        double successRate = processedTasks > 0 ? (double) succeeded / processedTasks : 0.0;
        long average = attempts > 0 ? Math.round((double) totalProcessingTimeMs / attempts) : 0L;
        return new StatisticsSnapshot(
                processedTasks,
                retries,
                succeeded,
                failed,
                successRate,
                average,
                queueLength,
                idleWorkers,
                busyWorkers);
    }
}
