package taskrunner.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskrunner.service.api.dto.CreateTaskRequest;
import taskrunner.service.api.dto.CreateTaskResponse;
import taskrunner.service.dispatch.TaskDispatcher;
import taskrunner.service.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Controller for task submission.
 *
 * POST /tasks - Queue a new task, returns its id
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final String TASKS_PATH = "/tasks";

    private final TaskDispatcher dispatcher;

    public TaskController(TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && TASKS_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req) {
        try {
            return handleCreateTask(req);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            log.debug("Malformed task body: {}", e.getOriginalMessage());
            return ControllerResponse.badRequest(CreateTaskRequest.INVALID_MESSAGE);
        } catch (IllegalStateException e) {
            log.warn("Task rejected: {}", e.getMessage());
            return ControllerResponse.unavailable("service is shutting down");
        }
    }

    /**
     * POST /tasks - Queue a new task
     */
    private ControllerResponse handleCreateTask(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request = body.isBlank() ? null
                : RouterHandler.mapper().readValue(body, CreateTaskRequest.class);

        if (request == null) {
            throw new IllegalArgumentException(CreateTaskRequest.INVALID_MESSAGE);
        }
        request.validate();

        String id = dispatcher.createTask(request.text());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(new CreateTaskResponse(id)));
    }
}
