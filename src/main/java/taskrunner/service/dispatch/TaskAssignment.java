package taskrunner.service.dispatch;

import taskrunner.service.model.Task;

/**
 * A task handed to a worker together with the number of the attempt it must perform.
 */
public record TaskAssignment(Task task, int attemptNumber) {
}
