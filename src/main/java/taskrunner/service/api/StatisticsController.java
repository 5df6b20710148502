package taskrunner.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskrunner.service.api.dto.StatisticsResponse;
import taskrunner.service.dispatch.TaskDispatcher;
import taskrunner.service.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /statistics
 */
public class StatisticsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StatisticsController.class);

    private final TaskDispatcher dispatcher;

    public StatisticsController(TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/statistics".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req) {
        try {
            StatisticsResponse response = StatisticsResponse.from(dispatcher.statistics());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Statistics serialization failed", e);
            return ControllerResponse.error("internal error");
        }
    }
}
