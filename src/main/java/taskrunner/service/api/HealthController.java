package taskrunner.service.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskrunner.service.api.dto.HealthResponse;
import taskrunner.service.dispatch.TaskDispatcher;
import taskrunner.service.model.StatisticsSnapshot;
import taskrunner.service.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final TaskDispatcher dispatcher;

    public HealthController(TaskDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req) {
        try {
            String uptime = formatUptime();

            if (dispatcher.isClosed()) {
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(uptime, VERSION)));
            }

            StatisticsSnapshot stats = dispatcher.statistics();
            HealthResponse response = HealthResponse.healthy(
                    uptime, VERSION, stats.poolSize(), dispatcher.config().workerPoolSize(), stats.queueLength());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
