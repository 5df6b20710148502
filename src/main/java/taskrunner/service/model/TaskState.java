package taskrunner.service.model;

/**
 * Task lifecycle state.
 */
public enum TaskState {
    /** Waiting in the dispatcher queue */
    QUEUED,
    /** Handed to a worker, attempt running */
    IN_FLIGHT,
    /** Last attempt failed, waiting for the retry delay to elapse */
    PENDING_RETRY,
    /** Finalized, either succeeded or failed after the last allowed attempt */
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
