package taskrunner.service.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Stand-in for real work: sleeps for a fixed duration, then fails with
 * probability errorPercentage / 100.
 */
public final class SimulatedTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTaskExecutor.class);

    private final Duration duration;
    private final int errorPercentage;
    private final DoubleSupplier random;

    public SimulatedTaskExecutor(Duration duration, int errorPercentage) {
        this(duration, errorPercentage, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random uniform source in [0, 1)
     */
    public SimulatedTaskExecutor(Duration duration, int errorPercentage, DoubleSupplier random) {
        if (errorPercentage < 0 || errorPercentage > 100) {
            throw new IllegalArgumentException("errorPercentage must be in 0..100");
        }
        this.duration = duration;
        this.errorPercentage = errorPercentage;
        this.random = random;
    }

    @Override
    public AttemptResult execute(String payload) throws InterruptedException {
        long start = System.nanoTime();

        Thread.sleep(duration.toMillis());

        boolean failed = random.getAsDouble() * 100.0 < errorPercentage;
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        if (failed) {
            log.debug("Simulated failure after {}ms", elapsedMs);
            return AttemptResult.failure(elapsedMs);
        }
        return AttemptResult.success(elapsedMs);
    }

    public Duration duration() {
        return duration;
    }

    public int errorPercentage() {
        return errorPercentage;
    }
}
