package taskrunner.service.scheduler;

import taskrunner.service.config.ServiceConfig;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private Scheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void runsOneShotActionAfterDelay() throws InterruptedException {
        scheduler = new Scheduler(ServiceConfig.defaults());
        CountDownLatch ran = new CountDownLatch(1);

        long start = System.nanoTime();
        assertTrue(scheduler.schedule("once", ran::countDown, Duration.ofMillis(50)));

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 45);
    }

    @Test
    void failingActionDoesNotKillTheThread() throws InterruptedException {
        scheduler = new Scheduler(ServiceConfig.defaults());
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule("broken", () -> {
            throw new IllegalStateException("boom");
        }, Duration.ZERO);
        scheduler.schedule("next", ran::countDown, Duration.ofMillis(10));

        assertTrue(ran.await(2, TimeUnit.SECONDS));
    }

    @Test
    void stoppedSchedulerDropsActions() {
        scheduler = new Scheduler(ServiceConfig.defaults());
        scheduler.stop();

        assertFalse(scheduler.schedule("late", () -> fail("must not run"), Duration.ZERO));
    }

    @Test
    @DisplayName("Statistics reporter runs periodically once started")
    void startRunsStatisticsReporter() throws InterruptedException {
        scheduler = new Scheduler(ServiceConfig.defaults()
                .withStatisticsLogInterval(Duration.ofMillis(20)));
        AtomicInteger runs = new AtomicInteger();

        scheduler.start(runs::incrementAndGet);
        assertTrue(scheduler.isRunning());

        long deadline = System.currentTimeMillis() + 2_000;
        while (runs.get() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(runs.get() >= 3, "reporter ran " + runs.get() + " times");

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
