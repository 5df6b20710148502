package taskrunner.service.model;

/**
 * Point-in-time view of the dispatcher counters and pool/queue sizes.
 */
public record StatisticsSnapshot(
        long processedTasks,
        long retries,
        long succeeded,
        long failed,
        double successRate,
        long averageProcessingTimeMsPerAttempt,
        int queueLength,
        int idleWorkers,
        int busyWorkers) {

    public int poolSize() {
        return idleWorkers + busyWorkers;
    }
}
