package taskrunner.service.scheduler;

import taskrunner.service.model.StatisticsSnapshot;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsReporterTest {

    private static StatisticsSnapshot snapshot(long processed, int queue) {
        return new StatisticsSnapshot(processed, 0, processed, 0, processed == 0 ? 0.0 : 1.0, 5, queue, 1, 0);
    }

    @Test
    void logsOnlyWhenSnapshotChanges() {
        AtomicReference<StatisticsSnapshot> current = new AtomicReference<>(snapshot(0, 0));
        StatisticsReporter reporter = new StatisticsReporter(current::get);

        assertTrue(reporter.report(), "first run always reports");
        assertFalse(reporter.report(), "unchanged snapshot is skipped");

        current.set(snapshot(1, 0));
        assertTrue(reporter.report());
        assertFalse(reporter.report());

        current.set(snapshot(1, 3));
        assertTrue(reporter.report(), "queue change counts as activity");
    }
}
