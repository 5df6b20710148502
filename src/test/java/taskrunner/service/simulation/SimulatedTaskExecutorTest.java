package taskrunner.service.simulation;

import taskrunner.service.simulation.TaskExecutor.AttemptResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedTaskExecutorTest {

    @Test
    void zeroPercentNeverFails() throws Exception {
        SimulatedTaskExecutor executor = new SimulatedTaskExecutor(Duration.ZERO, 0, () -> 0.0);

        for (int i = 0; i < 20; i++) {
            assertTrue(executor.execute("x").succeeded());
        }
    }

    @Test
    void hundredPercentAlwaysFails() throws Exception {
        SimulatedTaskExecutor executor = new SimulatedTaskExecutor(Duration.ZERO, 100, () -> 0.9999);

        assertFalse(executor.execute("x").succeeded());
    }

    @Test
    void drawBelowThresholdFails() throws Exception {
        assertFalse(new SimulatedTaskExecutor(Duration.ZERO, 20, () -> 0.19).execute("x").succeeded());
        assertTrue(new SimulatedTaskExecutor(Duration.ZERO, 20, () -> 0.20).execute("x").succeeded());
    }

    @Test
    void attemptTakesAtLeastTheSimulatedDuration() throws Exception {
        SimulatedTaskExecutor executor = new SimulatedTaskExecutor(Duration.ofMillis(40), 0);

        AttemptResult result = executor.execute("x");

        assertTrue(result.succeeded());
        assertTrue(result.durationMs() >= 40, "took " + result.durationMs() + "ms");
    }

    @Test
    void interruptAbortsAttempt() {
        SimulatedTaskExecutor executor = new SimulatedTaskExecutor(Duration.ofSeconds(5), 0);

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> executor.execute("x"));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsInvalidPercentage() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedTaskExecutor(Duration.ZERO, 101));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedTaskExecutor(Duration.ZERO, -1));
    }
}
