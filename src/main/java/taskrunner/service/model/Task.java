package taskrunner.service.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of submitted work.
 *
 * Identity and payload are immutable. The attempt counter is only touched by the
 * dispatcher while it holds its lock; the state is an atomic reference so that
 * finalization is a one-way compare-and-set.
 */
public final class Task {
    private final String id;
    private final String payload;
    private final Instant createdAt;
    private final AtomicReference<TaskState> state;
    private int attempts;

    private Task(String id, String payload, Instant createdAt, TaskState state, int attempts) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.payload = Objects.requireNonNull(payload, "payload is required");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
        this.state = new AtomicReference<>(Objects.requireNonNull(state, "state is required"));
        this.attempts = attempts;
    }

    /** Create a new queued task with a random id */
    public static Task create(String payload) {
        return new Task(UUID.randomUUID().toString(), payload, Instant.now(), TaskState.QUEUED, 0);
    }

    /** Create a task with an explicit id (tests, replays) */
    public static Task of(String id, String payload) {
        return new Task(id, payload, Instant.now(), TaskState.QUEUED, 0);
    }

    public String id() {
        return id;
    }

    public String payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public TaskState state() {
        return state.get();
    }

    public int attempts() {
        return attempts;
    }

    public boolean isCompleted() {
        return state.get().isTerminal();
    }

    /**
     * Hand-off: QUEUED -> IN_FLIGHT and bump the attempt counter.
     *
     * @return the number of the attempt that starts now, or -1 if the task was not queued
     */
    public int beginAttempt() {
        if (!state.compareAndSet(TaskState.QUEUED, TaskState.IN_FLIGHT)) {
            return -1;
        }
        attempts++;
        return attempts;
    }

    /** IN_FLIGHT -> PENDING_RETRY. False if the task was not in flight. */
    public boolean markPendingRetry() {
        return state.compareAndSet(TaskState.IN_FLIGHT, TaskState.PENDING_RETRY);
    }

    /** PENDING_RETRY -> QUEUED. False if the task was finalized meanwhile. */
    public boolean markRequeued() {
        return state.compareAndSet(TaskState.PENDING_RETRY, TaskState.QUEUED);
    }

    /**
     * Move to COMPLETED from any non-terminal state.
     *
     * @return true for exactly one caller over the lifetime of the task
     */
    public boolean complete() {
        while (true) {
            TaskState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, TaskState.COMPLETED)) {
                return true;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', state=" + state.get() + ", attempts=" + attempts + "}";
    }
}
