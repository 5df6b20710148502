package taskrunner.service.dispatch;

import taskrunner.service.config.ServiceConfig;
import taskrunner.service.model.AttemptReport;
import taskrunner.service.model.StatisticsSnapshot;
import taskrunner.service.model.Task;
import taskrunner.service.model.TaskOutcome;
import taskrunner.service.model.TaskState;
import taskrunner.service.scheduler.Scheduler;
import taskrunner.service.simulation.TaskExecutor;
import taskrunner.service.store.AttemptLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the task queue, the worker pool and the retry policy.
 *
 * All state (queue, task maps, counters, pool registry, worker assignments) is guarded
 * by one lock. Workers pull tasks with {@link #awaitNextTask} and report every attempt
 * with {@link #reportOutcome}; retry delays run on the {@link Scheduler} without the lock.
 *
 * Usage:
 *
 * <pre>
 * TaskDispatcher dispatcher = new TaskDispatcher(config, executor, attemptLog, scheduler, workerThreads);
 * String id = dispatcher.createTask("hello");
 * StatisticsSnapshot stats = dispatcher.statistics();
 * dispatcher.close();
 * </pre>
 */
public class TaskDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    /** How many finalized tasks are remembered to answer late duplicate reports */
    static final int FINISHED_HISTORY = 1024;

    private final ServiceConfig config;
    private final TaskExecutor taskExecutor;
    private final AttemptLog attemptLog;
    private final Scheduler scheduler;
    private final Executor workerLauncher;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition taskAvailable = lock.newCondition();

    private final Deque<Task> queue = new ArrayDeque<>();
    private final Map<String, Task> liveTasks = new HashMap<>();
    private final Map<String, Task> finishedTasks = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Task> eldest) {
            return size() > FINISHED_HISTORY;
        }
    };
    private final Map<String, Worker> workers = new LinkedHashMap<>();
    private final DispatchCounters counters = new DispatchCounters();

    private boolean closed = false;

    /**
     * @param workerLauncher runs each spawned {@link Worker}; one thread per worker
     */
    public TaskDispatcher(ServiceConfig config,
            TaskExecutor taskExecutor,
            AttemptLog attemptLog,
            Scheduler scheduler,
            Executor workerLauncher) {
        this.config = config;
        this.taskExecutor = taskExecutor;
        this.attemptLog = attemptLog;
        this.scheduler = scheduler;
        this.workerLauncher = workerLauncher;
    }

    /**
     * Queue a new task. Returns immediately; processing happens on the pool.
     *
     * @return the id of the new task
     * @throws IllegalStateException if the dispatcher has been closed
     */
    public String createTask(String message) {
        Task task = Task.create(message);

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("dispatcher is closed");
            }
            liveTasks.put(task.id(), task);
            enqueue(task);
        } finally {
            lock.unlock();
        }

        log.debug("Task {} queued", task.id());
        return task.id();
    }

    /**
     * Block until a task is available or the timeout elapses.
     *
     * On hand-off the head of the queue moves to IN_FLIGHT, its attempt counter is bumped
     * and the worker becomes BUSY with that assignment, all in one critical section. On
     * timeout the worker is removed from the pool in that same section, so a task enqueued
     * afterwards always sees the smaller pool and can spawn a replacement.
     *
     * @return the assignment, or null if the worker must retire
     * @throws InterruptedException if the worker thread is interrupted while waiting
     */
    public TaskAssignment awaitNextTask(Worker worker, Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();

        lock.lock();
        try {
            if (workers.get(worker.id()) != worker) {
                return null;
            }
            while (true) {
                if (closed) {
                    removeWorker(worker, "dispatcher closed");
                    return null;
                }

                Task task = queue.pollFirst();
                if (task != null) {
                    int attempt = task.beginAttempt();
                    if (attempt < 0) {
                        // finalized while queued, nothing left to run
                        log.warn("Skipping task {} found in queue in state {}", task.id(), task.state());
                        finish(task);
                        continue;
                    }
                    TaskAssignment assignment = new TaskAssignment(task, attempt);
                    worker.assign(assignment);
                    return assignment;
                }

                if (nanos <= 0L) {
                    removeWorker(worker, "idle timeout");
                    return null;
                }
                nanos = taskAvailable.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the outcome of one attempt.
     *
     * Only the report for the attempt a worker is currently running counts. Reports for
     * earlier attempts, repeated reports and reports from other workers are ignored and
     * leave counters, task state and worker state untouched.
     */
    public TaskOutcome reportOutcome(AttemptReport report) {
        TaskOutcome outcome;

        lock.lock();
        try {
            outcome = applyReport(report);

            // worker may have become idle
            maybeSpawnWorker();
        } finally {
            lock.unlock();
        }

        switch (outcome) {
            case SUCCEEDED -> log.debug("Task {} succeeded on attempt {}", report.taskId(), report.attemptNumber());
            case RETRY_SCHEDULED -> log.debug("Task {} attempt {} failed, retry in {}ms",
                    report.taskId(), report.attemptNumber(), config.retryDelay().toMillis());
            case FAILED -> log.info("Task {} permanently failed after {} attempts",
                    report.taskId(), report.attemptNumber());
            case ALREADY_COMPLETED, DUPLICATE_REPORT -> log.debug("Task {} attempt {} report from worker {} ignored: {}",
                    report.taskId(), report.attemptNumber(), report.workerId(), outcome);
            case NOT_FOUND -> log.warn("Report for unknown task {}", report.taskId());
        }
        return outcome;
    }

    // lock held
    private TaskOutcome applyReport(AttemptReport report) {
        Task task = liveTasks.get(report.taskId());
        if (task == null) {
            task = finishedTasks.get(report.taskId());
        }
        if (task == null) {
            return TaskOutcome.NOT_FOUND;
        }
        if (task.isCompleted()) {
            return TaskOutcome.ALREADY_COMPLETED;
        }

        Worker worker = report.workerId() != null ? workers.get(report.workerId()) : null;
        if (worker == null
                || !worker.isRunning(task, report.attemptNumber())
                || task.state() != TaskState.IN_FLIGHT
                || task.attempts() != report.attemptNumber()) {
            return TaskOutcome.DUPLICATE_REPORT;
        }

        worker.release();
        counters.recordAttempt(report.durationMs());

        if (report.success()) {
            task.complete();
            counters.recordSuccess();
            finish(task);
            return TaskOutcome.SUCCEEDED;
        }

        if (report.attemptNumber() < config.maxAttempts()) {
            task.markPendingRetry();
            counters.recordRetry();
            scheduleRetry(task);
            return TaskOutcome.RETRY_SCHEDULED;
        }

        task.complete();
        counters.recordFailure();
        finish(task);
        return TaskOutcome.FAILED;
    }

    private void finish(Task task) {
        liveTasks.remove(task.id());
        finishedTasks.put(task.id(), task);
    }

    private void scheduleRetry(Task task) {
        boolean scheduled = scheduler.schedule("retry-" + task.id(), () -> requeue(task), config.retryDelay());
        if (!scheduled) {
            log.warn("Retry of task {} dropped, scheduler is stopped", task.id());
        }
    }

    /**
     * Put a task that waited out its retry delay back at the tail of the queue.
     */
    void requeue(Task task) {
        lock.lock();
        try {
            if (closed || !task.markRequeued()) {
                return;
            }
            enqueue(task);
        } finally {
            lock.unlock();
        }
        log.debug("Task {} requeued for attempt {}", task.id(), task.attempts() + 1);
    }

    // lock held
    private void enqueue(Task task) {
        queue.addLast(task);
        taskAvailable.signal();
        maybeSpawnWorker();
    }

    /**
     * Spawn one worker if queued demand exceeds idle supply and the pool is below its cap.
     */
    // lock held
    private void maybeSpawnWorker() {
        if (closed) {
            return;
        }
        int idle = countWorkers(WorkerState.IDLE);
        if (queue.size() <= idle || workers.size() >= config.workerPoolSize()) {
            return;
        }

        String id = newWorkerId();
        Worker worker = new Worker(id, this, taskExecutor, attemptLog, config.workerIdleTimeout());
        workers.put(id, worker);
        try {
            workerLauncher.execute(worker);
        } catch (RejectedExecutionException e) {
            workers.remove(id);
            log.warn("Could not start worker {}: {}", id, e.getMessage());
            return;
        }
        log.debug("Spawned worker {} (pool size {}/{})", id, workers.size(), config.workerPoolSize());
    }

    private String newWorkerId() {
        String id;
        do {
            id = String.valueOf(ThreadLocalRandom.current().nextInt(100_000, 1_000_000));
        } while (workers.containsKey(id));
        return id;
    }

    private int countWorkers(WorkerState state) {
        int n = 0;
        for (Worker w : workers.values()) {
            if (w.state() == state) {
                n++;
            }
        }
        return n;
    }

    /**
     * Remove a worker from the pool. Called by the worker itself when its loop ends.
     * An attempt the worker still holds is counted as failed, so its task is retried or
     * finalized instead of staying in flight.
     */
    void retire(Worker worker) {
        lock.lock();
        try {
            if (workers.get(worker.id()) != worker) {
                return;
            }
            TaskAssignment held = worker.assignment();
            if (held != null) {
                log.warn("Worker {} stopped during task {} attempt {}, counting it as failed",
                        worker.id(), held.task().id(), held.attemptNumber());
                applyReport(AttemptReport.failure(held.task().id(), worker.id(), held.attemptNumber(), 0L));
            }
            removeWorker(worker, "stopped");
            // a worker that died with tasks waiting must be replaced
            maybeSpawnWorker();
        } finally {
            lock.unlock();
        }
    }

    // lock held
    private void removeWorker(Worker worker, String reason) {
        workers.remove(worker.id());
        worker.setState(WorkerState.RETIRED);
        log.debug("Worker {} retired ({}), pool size {}", worker.id(), reason, workers.size());
    }

    /**
     * Consistent snapshot of counters, queue length and pool utilization.
     */
    public StatisticsSnapshot statistics() {
        lock.lock();
        try {
            return counters.snapshot(
                    queue.size(),
                    countWorkers(WorkerState.IDLE),
                    countWorkers(WorkerState.BUSY));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current pool members.
     */
    public List<Worker> workers() {
        lock.lock();
        try {
            return new ArrayList<>(workers.values());
        } finally {
            lock.unlock();
        }
    }

    public int poolSize() {
        lock.lock();
        try {
            return workers.size();
        } finally {
            lock.unlock();
        }
    }

    public ServiceConfig config() {
        return config;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting tasks and stop all workers. Queued tasks are dropped.
     */
    @Override
    public void close() {
        List<Worker> running;

        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            running = new ArrayList<>(workers.values());
            taskAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        for (Worker worker : running) {
            worker.interrupt();
        }
        log.info("Dispatcher closed, {} workers stopped, {} attempts total", running.size(), attemptsTotal());
    }

    private long attemptsTotal() {
        lock.lock();
        try {
            return counters.attempts();
        } finally {
            lock.unlock();
        }
    }
}
