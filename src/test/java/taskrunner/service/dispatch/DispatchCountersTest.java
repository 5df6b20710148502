package taskrunner.service.dispatch;

import taskrunner.service.model.StatisticsSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DispatchCountersTest {

    @Test
    void emptyCountersGiveZeroRates() {
        StatisticsSnapshot s = new DispatchCounters().snapshot(0, 0, 0);

        assertEquals(0, s.processedTasks());
        assertEquals(0.0, s.successRate());
        assertEquals(0, s.averageProcessingTimeMsPerAttempt());
    }

    @Test
    void successRateIsSucceededOverProcessed() {
        DispatchCounters counters = new DispatchCounters();
        counters.recordSuccess();
        counters.recordSuccess();
        counters.recordSuccess();
        counters.recordFailure();

        StatisticsSnapshot s = counters.snapshot(0, 0, 0);
        assertEquals(4, s.processedTasks());
        assertEquals(3, s.succeeded());
        assertEquals(1, s.failed());
        assertEquals(0.75, s.successRate(), 1e-9);
    }

    @Test
    void averageIsRoundedPerAttempt() {
        DispatchCounters counters = new DispatchCounters();
        counters.recordAttempt(10);
        counters.recordAttempt(21);

        // 31 / 2 = 15.5
        assertEquals(16, counters.snapshot(0, 0, 0).averageProcessingTimeMsPerAttempt());

        counters.recordAttempt(10);
        // 41 / 3 = 13.67
        assertEquals(14, counters.snapshot(0, 0, 0).averageProcessingTimeMsPerAttempt());
    }

    @Test
    void negativeDurationsDoNotLowerTheAverage() {
        DispatchCounters counters = new DispatchCounters();
        counters.recordAttempt(-5);
        counters.recordAttempt(10);

        assertEquals(5, counters.snapshot(0, 0, 0).averageProcessingTimeMsPerAttempt());
    }

    @Test
    void liveSizesArePassedThrough() {
        DispatchCounters counters = new DispatchCounters();
        counters.recordRetry();

        StatisticsSnapshot s = counters.snapshot(7, 2, 3);
        assertEquals(1, s.retries());
        assertEquals(7, s.queueLength());
        assertEquals(2, s.idleWorkers());
        assertEquals(3, s.busyWorkers());
        assertEquals(5, s.poolSize());
    }
}
