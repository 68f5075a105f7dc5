package adcp.workflow.api;

import adcp.workflow.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * A group of HTTP endpoints. The router offers each request to the registered
 * controllers in order and the first one that matches handles it.
 */
public interface Controller {

    boolean matches(HttpMethod method, String path);

    /**
     * @param path request path without the query string
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Status plus an already serialized JSON body.
     */
    record ControllerResponse(HttpResponseStatus status, String body) {

        private static final Logger log = LoggerFactory.getLogger(ControllerResponse.class);

        public static ControllerResponse ok(Object body) {
            return of(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse of(HttpResponseStatus status, Object body) {
            try {
                return new ControllerResponse(status, Json.mapper().writeValueAsString(body));
            } catch (JsonProcessingException e) {
                log.error("Could not serialize {} response body", status.code(), e);
                return message(HttpResponseStatus.INTERNAL_SERVER_ERROR, "response serialization failed");
            }
        }

        /** Body {@code {"error": message}}. */
        public static ControllerResponse message(HttpResponseStatus status, String message) {
            return of(status, Map.of("error", message != null ? message : ""));
        }
    }
}
