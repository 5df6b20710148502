package taskrunner.service.dispatch;

import taskrunner.service.model.AttemptReport;
import taskrunner.service.model.Task;
import taskrunner.service.simulation.TaskExecutor;
import taskrunner.service.simulation.TaskExecutor.AttemptResult;
import taskrunner.service.store.AttemptLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * A single pool worker.
 * Loops: wait for a task (bounded by the idle timeout), log the attempt, execute, report.
 * Retires when no task arrives within the idle timeout, or on Thread.interrupt().
 */
public final class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String id;
    private final TaskDispatcher dispatcher;
    private final TaskExecutor executor;
    private final AttemptLog attemptLog;
    private final Duration idleTimeout;

    // written by the dispatcher under its lock
    private volatile WorkerState state = WorkerState.IDLE;
    private volatile TaskAssignment assignment;
    private volatile Thread runner;

    Worker(String id,
            TaskDispatcher dispatcher,
            TaskExecutor executor,
            AttemptLog attemptLog,
            Duration idleTimeout) {
        this.id = id;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.attemptLog = attemptLog;
        this.idleTimeout = idleTimeout;
    }

    public String id() {
        return id;
    }

    public WorkerState state() {
        return state;
    }

    /** The attempt this worker is running, or null when idle */
    public TaskAssignment assignment() {
        return assignment;
    }

    void setState(WorkerState state) {
        this.state = state;
    }

    void assign(TaskAssignment assignment) {
        this.assignment = assignment;
        this.state = WorkerState.BUSY;
    }

    void release() {
        this.assignment = null;
        this.state = WorkerState.IDLE;
    }

    boolean isRunning(Task task, int attemptNumber) {
        TaskAssignment current = assignment;
        return current != null && current.task() == task && current.attemptNumber() == attemptNumber;
    }

    /** Ask the worker thread to stop; an attempt in progress is reported as failed. */
    void interrupt() {
        Thread t = runner;
        if (t != null) {
            t.interrupt();
        }
    }

    @Override
    public void run() {
        Thread thread = Thread.currentThread();
        String threadName = thread.getName();
        runner = thread;
        thread.setName("worker-" + id);
        log.debug("Worker {} started", id);

        try {
            while (!thread.isInterrupted()) {
                TaskAssignment next = dispatcher.awaitNextTask(this, idleTimeout);
                if (next == null) {
                    log.debug("Worker {} got no task within {}ms", id, idleTimeout.toMillis());
                    break;
                }
                process(next);
            }
        } catch (InterruptedException e) {
            thread.interrupt();
        } catch (RuntimeException e) {
            log.error("Worker {} crashed", id, e);
        } finally {
            dispatcher.retire(this);
            runner = null;
            thread.setName(threadName);
            log.debug("Worker {} stopped", id);
        }
    }

    /**
     * Run one attempt and report it. Exactly one report is sent, whatever happens.
     */
    private void process(TaskAssignment next) throws InterruptedException {
        Task task = next.task();
        int attempt = next.attemptNumber();

        logAttempt(task, attempt);

        long start = System.nanoTime();
        AttemptResult result = null;
        try {
            result = executor.execute(task.payload());
            if (result == null) {
                log.error("Worker {} got no result for task {} attempt {}", id, task.id(), attempt);
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Worker {} fault on task {} attempt {}", id, task.id(), attempt, e);
        } finally {
            boolean succeeded = result != null && result.succeeded();
            long durationMs = result != null ? result.durationMs() : elapsedMs(start);

            log.debug("Worker {} task {} attempt {} -> {} in {}ms",
                    id, task.id(), attempt, succeeded ? "ok" : "failed", durationMs);

            dispatcher.reportOutcome(new AttemptReport(task.id(), id, attempt, succeeded, durationMs));
        }
    }

    private void logAttempt(Task task, int attempt) {
        try {
            attemptLog.append(new AttemptLog.Entry(Instant.now(), id, task.id(), attempt, task.payload()));
        } catch (RuntimeException e) {
            log.error("Worker {} could not log task {} attempt {}", id, task.id(), attempt, e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', state=" + state + "}";
    }
}
