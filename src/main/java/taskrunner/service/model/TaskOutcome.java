package taskrunner.service.model;

/**
 * Result of reporting one attempt to the dispatcher.
 */
public enum TaskOutcome {
    /** Attempt succeeded and the task was finalized as succeeded */
    SUCCEEDED,

    /** Attempt failed, the task will be requeued after the retry delay */
    RETRY_SCHEDULED,

    /** Attempt failed and it was the last allowed attempt */
    FAILED,

    /** Task was already finalized - counters untouched */
    ALREADY_COMPLETED,

    /** Failure reported for a task that is not in flight (already pending retry) */
    DUPLICATE_REPORT,

    /** Task not found */
    NOT_FOUND
}
