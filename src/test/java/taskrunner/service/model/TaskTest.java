package taskrunner.service.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void createQueuedTask() {
        Task task = Task.create("hello");

        assertNotNull(task.id());
        assertEquals("hello", task.payload());
        assertEquals(TaskState.QUEUED, task.state());
        assertEquals(0, task.attempts());
        assertNotNull(task.createdAt());
        assertFalse(task.isCompleted());
    }

    @Test
    void idsAreUnique() {
        assertNotEquals(Task.create("a").id(), Task.create("a").id());
    }

    @Test
    void beginAttemptCountsOnlyQueuedHandOffs() {
        Task task = Task.of("t1", "{}");

        assertEquals(1, task.beginAttempt());
        assertEquals(TaskState.IN_FLIGHT, task.state());

        // already in flight - no second hand-off
        assertEquals(-1, task.beginAttempt());
        assertEquals(1, task.attempts());
    }

    @Test
    void retryCycle() {
        Task task = Task.of("t1", "{}");
        task.beginAttempt();

        assertTrue(task.markPendingRetry());
        assertEquals(TaskState.PENDING_RETRY, task.state());
        assertFalse(task.markPendingRetry());

        assertTrue(task.markRequeued());
        assertEquals(TaskState.QUEUED, task.state());

        assertEquals(2, task.beginAttempt());
    }

    @Test
    void completeIsOneWay() {
        Task task = Task.of("t1", "{}");
        task.beginAttempt();

        assertTrue(task.complete());
        assertFalse(task.complete());
        assertTrue(task.isCompleted());

        assertFalse(task.markPendingRetry());
        assertFalse(task.markRequeued());
        assertEquals(-1, task.beginAttempt());
    }

    @Test
    void completeWhilePendingRetryBlocksRequeue() {
        Task task = Task.of("t1", "{}");
        task.beginAttempt();
        task.markPendingRetry();

        assertTrue(task.complete());
        assertFalse(task.markRequeued());
        assertEquals(TaskState.COMPLETED, task.state());
    }

    @Test
    void equalityById() {
        Task a = Task.of("same", "x");
        Task b = Task.of("same", "y");
        Task c = Task.of("other", "x");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }
}
