package taskrunner.service.dispatch;

/**
 * Worker lifecycle: IDLE -> BUSY -> IDLE -> ... -> RETIRED.
 */
public enum WorkerState {
    /** Waiting for a task, idle timeout running */
    IDLE,
    /** Executing an attempt */
    BUSY,
    /** Left the pool; terminal */
    RETIRED
}
