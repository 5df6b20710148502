package taskrunner.service.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskrunner.service.server.RouterHandler;

/**
 * One route of the JSON API.
 */
public interface Controller {

    /** True if this controller serves {@code method} on {@code path} (query string stripped). */
    boolean matches(HttpMethod method, String path);

    ControllerResponse handle(FullHttpRequest req);

    /**
     * Status and JSON body of a response.
     */
    record ControllerResponse(HttpResponseStatus status, String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, body);
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse unavailable(String message) {
            return failure(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        /** {@code {"error": message}} */
        private static ControllerResponse failure(HttpResponseStatus status, String message) {
            String body = RouterHandler.mapper().createObjectNode()
                    .put("error", message == null ? "" : message)
                    .toString();
            return new ControllerResponse(status, body);
        }
    }
}
