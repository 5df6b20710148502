package taskrunner.service.scheduler;

import taskrunner.service.model.StatisticsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Periodically logs a one-line statistics summary.
 *
 * Nothing is logged while the snapshot is unchanged since the previous run,
 * so an idle service stays quiet.
 */
public class StatisticsReporter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatisticsReporter.class);

    private final Supplier<StatisticsSnapshot> statistics;
    private StatisticsSnapshot last;

    public StatisticsReporter(Supplier<StatisticsSnapshot> statistics) {
        this.statistics = statistics;
    }

    @Override
    public void run() {
        report();
    }

    /**
     * Log the current snapshot if it differs from the last one.
     *
     * @return true if a line was logged
     */
    public boolean report() {
        StatisticsSnapshot current = statistics.get();
        if (Objects.equals(current, last)) {
            return false;
        }
        last = current;

        log.info("stats: processed={} succeeded={} failed={} retries={} avgMs={} queue={} busy={} idle={}",
                current.processedTasks(), current.succeeded(), current.failed(), current.retries(),
                current.averageProcessingTimeMsPerAttempt(), current.queueLength(),
                current.busyWorkers(), current.idleWorkers());
        return true;
    }
}
