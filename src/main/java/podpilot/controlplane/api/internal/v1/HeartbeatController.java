package podpilot.controlplane.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.OperationResponse;
import podpilot.controlplane.api.internal.v1.dto.HeartbeatRequest;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.NodeRegistry;

/**
 * Controller for node agent heartbeats (internal API).
 * POST /internal/v1/heartbeat
 */
public class HeartbeatController implements Controller {

    private final NodeRegistry nodeRegistry;

    public HeartbeatController(NodeRegistry nodeRegistry) {
        this.nodeRegistry = nodeRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/heartbeat".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HeartbeatRequest request = RouterHandler.readBody(req, HeartbeatRequest.class);
        request.validate();

        nodeRegistry.heartbeat(request.nodeId());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }
}
