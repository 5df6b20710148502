package taskrunner.service.scheduler;

import taskrunner.service.config.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates deferred and periodic background work:
 * - delayed re-insertion of failed tasks (one-shot, see {@link #schedule})
 * - StatisticsReporter: periodic statistics summary in the service log
 *
 * Uses a single-threaded executor; scheduled actions must be short and never block.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final ServiceConfig config;

    private volatile boolean running = false;

    public Scheduler(ServiceConfig config) {
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "taskrunner-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.config = config;
    }

    /**
     * Start periodic jobs.
     *
     * @param statisticsReporter runnable logging a statistics summary
     */
    public void start(Runnable statisticsReporter) {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.statisticsLogInterval().toMillis();
        if (intervalMs > 0) {
            executor.scheduleAtFixedRate(
                    wrapRunnable("statistics-reporter", statisticsReporter),
                    intervalMs, // initial delay
                    intervalMs, // interval
                    TimeUnit.MILLISECONDS);
            log.info("Statistics reporter scheduled every {}ms", intervalMs);
        }

        log.info("Scheduler started");
    }

    /**
     * Run an action once after a delay.
     *
     * @return false if the scheduler has been stopped and the action was dropped
     */
    public boolean schedule(String name, Runnable action, Duration delay) {
        try {
            executor.schedule(wrapRunnable(name, action), delay.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler is shut down, dropping {}", name);
            return false;
        }
    }

    /**
     * Stop the scheduler gracefully. Pending one-shot actions are discarded.
     */
    public void stop() {
        if (executor.isShutdown()) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check if periodic jobs are running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
