package taskworker.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import taskworker.api.Controller;
import taskworker.api.Controller.ControllerResponse;
import taskworker.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Routes /api/v1 requests to the first controller that matches.
 * POSTs carry the admin key in {@value #KEY_HEADER} when one is configured.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    public static final String KEY_HEADER = "X-Tasker-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final WorkerConfig config;

    public RouterHandler(WorkerConfig config) {
        this.config = config;
    }

    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();
        send(ctx, route(ctx, req, method, path));
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path) {
        if (!authorized(req)) {
            log.warn("Rejected {} {} without a valid admin key", method, path);
            return ControllerResponse.forbidden();
        }

        Optional<Controller> controller = controllers.stream()
                .filter(c -> c.matches(method, path))
                .findFirst();
        if (controller.isEmpty()) {
            log.debug("No route for {} {}", method, path);
            return ControllerResponse.notFound("not found");
        }

        try {
            return controller.get().handle(ctx, req, path);
        } catch (IllegalArgumentException e) {
            log.warn("Bad request {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Request {} {} failed", method, path, e);
            return ControllerResponse.error(e.toString());
        }
    }

    private boolean authorized(FullHttpRequest req) {
        if (!config.hasAdminKey() || !HttpMethod.POST.equals(req.method())) {
            return true;
        }
        return config.adminKey().equals(req.headers().get(KEY_HEADER));
    }

    private static void send(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body() != null ? response.body().getBytes(StandardCharsets.UTF_8) : new byte[0];
        FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        out.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        out.headers().setInt(CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(out).addListener(f -> {
            if (!f.isSuccess()) {
                log.error("Failed to write response, closing channel", f.cause());
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Admin channel error", cause);
        ctx.close();
    }
}
