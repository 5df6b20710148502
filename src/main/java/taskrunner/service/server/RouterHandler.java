package taskrunner.service.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import taskrunner.service.api.Controller;
import taskrunner.service.api.Controller.ControllerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to the first registered controller that matches.
 *
 * No match gives 404, an IllegalArgumentException from a controller 400, anything else 500.
 * Shared across channels; the controller list is the only state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Add a controller. Controllers are tried in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        ControllerResponse response = route(req);
        write(ctx, response, HttpUtil.isKeepAlive(req));
    }

    private ControllerResponse route(FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(req);
                }
            }
            log.debug("No route for {} {}", method, path);
            return ControllerResponse.notFound("not found");
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * Write a response; on failure the connection is closed rather than left hanging.
     */
    private void write(ChannelHandlerContext ctx, ControllerResponse response, boolean keepAlive) {
        try {
            byte[] bytes = response.body() == null ? new byte[0]
                    : response.body().getBytes(StandardCharsets.UTF_8);
            FullHttpResponse res = new DefaultFullHttpResponse(
                    HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
            res.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
            res.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

            if (keepAlive) {
                HttpUtil.setKeepAlive(res, true);
                ctx.writeAndFlush(res);
            } else {
                ctx.writeAndFlush(res).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Exception e) {
            log.error("Failed to write response", e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error: {}", cause.getMessage(), cause);
        if (ctx.channel().isActive()) {
            write(ctx, ControllerResponse.error("channel error"), false);
        } else {
            ctx.close();
        }
    }

    /**
     * Shared ObjectMapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
