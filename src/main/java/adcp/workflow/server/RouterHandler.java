package adcp.workflow.server;

import adcp.workflow.api.Controller;
import adcp.workflow.api.Controller.ControllerResponse;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches requests to the first matching {@link Controller} and writes its JSON response.
 * Unclaimed requests get a JSON 404; an {@link IllegalArgumentException} escaping a controller
 * becomes a 400 and anything else a 500.
 * <p>
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

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
        String path = new QueryStringDecoder(req.uri()).path();
        write(ctx, dispatch(ctx, req, path));
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Controller controller = controllers.stream()
                .filter(c -> c.matches(req.method(), path))
                .findFirst()
                .orElse(null);
        if (controller == null) {
            log.debug("No route for {} {}", req.method(), path);
            return ControllerResponse.message(NOT_FOUND, "no route for " + req.method() + " " + path);
        }

        try {
            return controller.handle(ctx, req, path);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.message(BAD_REQUEST, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed on {} {}", controller.getClass().getSimpleName(), req.method(), path, e);
            return ControllerResponse.message(INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write {} response: {}", response.status().code(), future.cause().getMessage());
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        if (!ctx.channel().isActive()) {
            ctx.close();
            return;
        }
        byte[] bytes = ControllerResponse.message(INTERNAL_SERVER_ERROR, "channel error").body()
                .getBytes(StandardCharsets.UTF_8);
        FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                Unpooled.wrappedBuffer(bytes));
        http.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
    }
}
