package podpilot.controlplane.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 *
 * Domain exceptions are not caught here; they bubble to the router,
 * which maps them to status codes.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Response from a controller. Bodies are already-serialized JSON.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse created(String body) {
            return json(HttpResponseStatus.CREATED, body);
        }

        public static ControllerResponse unavailable(String body) {
            return json(HttpResponseStatus.SERVICE_UNAVAILABLE, body);
        }
    }
}
