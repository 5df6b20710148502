package taskrunner.service.config;

import taskrunner.service.api.HealthController;
import taskrunner.service.api.StatisticsController;
import taskrunner.service.api.TaskController;
import taskrunner.service.dispatch.TaskDispatcher;
import taskrunner.service.scheduler.Scheduler;
import taskrunner.service.scheduler.StatisticsReporter;
import taskrunner.service.server.RouterHandler;
import taskrunner.service.simulation.SimulatedTaskExecutor;
import taskrunner.service.simulation.TaskExecutor;
import taskrunner.service.store.AttemptLog;
import taskrunner.service.store.FileAttemptLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ServiceConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * String id = deps.dispatcher().createTask("hello");
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ServiceConfig config;
    private final AttemptLog attemptLog;
    private final TaskExecutor taskExecutor;
    private final Scheduler scheduler;
    private final ExecutorService workerThreads;
    private final TaskDispatcher dispatcher;
    private final StatisticsReporter statisticsReporter;

    // Controllers
    private final TaskController taskController;
    private final StatisticsController statisticsController;
    private final HealthController healthController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(ServiceConfig config, AttemptLog attemptLog, TaskExecutor taskExecutor) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.attemptLog = attemptLog;
        this.taskExecutor = taskExecutor;
        this.scheduler = new Scheduler(config);
        this.workerThreads = Executors.newCachedThreadPool(new WorkerThreadFactory());

        // Core
        this.dispatcher = new TaskDispatcher(config, taskExecutor, attemptLog, scheduler, workerThreads);
        this.statisticsReporter = new StatisticsReporter(dispatcher::statistics);

        // Controllers
        this.taskController = new TaskController(dispatcher);
        this.statisticsController = new StatisticsController(dispatcher);
        this.healthController = new HealthController(dispatcher);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, writing attempts to {@code config.logPath()}
     * and simulating work per the config.
     */
    public static Dependencies create(ServiceConfig config) {
        config.validate();
        return create(config,
                FileAttemptLog.open(Path.of(config.logPath())),
                new SimulatedTaskExecutor(config.simulatedDuration(), config.errorPercentage()));
    }

    /**
     * Create dependencies with a custom attempt log and executor.
     */
    public static Dependencies create(ServiceConfig config, AttemptLog attemptLog, TaskExecutor taskExecutor) {
        return new Dependencies(config.validate(), attemptLog, taskExecutor);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ServiceConfig.fromEnv());
    }

    // Getters
    public ServiceConfig config() {
        return config;
    }

    public AttemptLog attemptLog() {
        return attemptLog;
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public StatisticsReporter statisticsReporter() {
        return statisticsReporter;
    }

    // Controller getters
    public TaskController taskController() {
        return taskController;
    }

    public StatisticsController statisticsController() {
        return statisticsController;
    }

    public HealthController healthController() {
        return healthController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(taskController)
                    .registerController(statisticsController)
                    .registerController(healthController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start periodic background jobs (statistics summary).
     * Retry scheduling works without this.
     */
    public void startScheduler() {
        scheduler.start(statisticsReporter);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop intake and workers first, then timers, then flush the log
        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher: {}", e.getMessage());
        }

        workerThreads.shutdownNow();
        try {
            if (!workerThreads.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            attemptLog.close();
        } catch (Exception e) {
            log.warn("Error closing attempt log: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    /** Daemon threads so a stuck attempt never keeps the JVM alive */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "worker-thread-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
