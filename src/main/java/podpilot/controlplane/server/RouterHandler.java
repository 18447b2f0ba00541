package podpilot.controlplane.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.Controller.ControllerResponse;
import podpilot.controlplane.api.ErrorResponse;
import podpilot.controlplane.config.ControlPlaneConfig;
import podpilot.controlplane.exception.ClusterException;
import podpilot.controlplane.exception.ErrorCode;
import podpilot.controlplane.exception.MissingFieldException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (node agent API, guarded by the agent key when one is configured)
 *
 * Cluster exceptions are translated to status codes here, so controllers
 * only deal with the success path.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final String AGENT_KEY_HEADER = "X-PodPilot-Key";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final ControlPlaneConfig config;

    public RouterHandler(ControlPlaneConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
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
        HttpMethod method = req.method();
        String uri = req.uri();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeError(ctx, FORBIDDEN, ErrorResponse.of("forbidden", "FORBIDDEN"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    write(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeError(ctx, NOT_FOUND, ErrorResponse.of("not found", "NOT_FOUND"));

        } catch (ClusterException e) {
            HttpResponseStatus status = statusFor(e.code());
            if (status.code() >= 500) {
                log.error("{} {} failed", method, path, e);
            } else {
                log.info("{} {} rejected: {} ({})", method, path, e.getMessage(), e.code());
            }
            writeError(ctx, status, ErrorResponse.from(e));

        } catch (JsonProcessingException e) {
            log.warn("Malformed body for {} {}: {}", method, path, e.getOriginalMessage());
            writeError(ctx, BAD_REQUEST,
                    ErrorResponse.of("malformed request body", ErrorCode.MISSING_FIELD.name()));

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeError(ctx, BAD_REQUEST, ErrorResponse.of(e.getMessage(), "BAD_REQUEST"));

        } catch (Throwable t) {
            log.error("Handler error: {} {} - Body: [{}]",
                    method, path, req.content().toString(StandardCharsets.UTF_8), t);
            writeError(ctx, INTERNAL_SERVER_ERROR, ErrorResponse.of(t.toString(), "INTERNAL_ERROR"));
        }
    }

    /**
     * HTTP status for a cluster error code.
     */
    static HttpResponseStatus statusFor(ErrorCode code) {
        return switch (code) {
            case DUPLICATE_NODE, DUPLICATE_POD -> CONFLICT;
            case NODE_NOT_FOUND -> NOT_FOUND;
            case MISSING_FIELD -> BAD_REQUEST;
            case INSUFFICIENT_CLUSTER_CAPACITY, NO_FEASIBLE_NODE -> UNPROCESSABLE_ENTITY;
            case STORE_FAILURE -> INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true;
        }
        if (!path.startsWith("/internal/")) {
            return true;
        }
        return config.agentKey().equals(req.headers().get(AGENT_KEY_HEADER));
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, ErrorResponse error) {
        String body;
        try {
            body = MAPPER.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error response", e);
            body = "{\"error\":\"internal error\",\"code\":\"INTERNAL_ERROR\"}";
        }
        write(ctx, status, "application/json", body);
    }

    /**
     * Write a response; on failure fall back to a bare 500, then close.
     */
    private void write(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response", t);
            try {
                FullHttpResponse fallback = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR);
                fallback.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
                ctx.writeAndFlush(fallback);
            } catch (Throwable t2) {
                log.error("Complete failure writing error response", t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel", cause);
        ctx.close();
    }

    /**
     * Read a JSON request body. A body that decodes to {@code null} counts as missing.
     */
    public static <T> T readBody(FullHttpRequest req, Class<T> type) throws JsonProcessingException {
        T value = MAPPER.readValue(req.content().toString(StandardCharsets.UTF_8), type);
        if (value == null) {
            throw new MissingFieldException("body", "request body is required");
        }
        return value;
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
