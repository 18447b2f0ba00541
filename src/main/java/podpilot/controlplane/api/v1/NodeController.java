package podpilot.controlplane.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.OperationResponse;
import podpilot.controlplane.api.v1.dto.AddNodeRequest;
import podpilot.controlplane.api.v1.dto.EvictionResponse;
import podpilot.controlplane.api.v1.dto.NodeResponse;
import podpilot.controlplane.api.v1.dto.ScaleUpRequest;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.NodeRegistry;

import java.util.List;
import java.util.Map;

/**
 * Controller for node lifecycle (public API).
 * POST   /api/v1/nodes              - Add node
 * POST   /api/v1/nodes/scale        - Add several default-sized nodes
 * GET    /api/v1/nodes              - List nodes in registration order
 * DELETE /api/v1/nodes/{id}         - Remove node, evicting its pods
 * POST   /api/v1/nodes/{id}/fail    - Manually fail node
 * POST   /api/v1/nodes/{id}/recover - Manually recover node
 */
public class NodeController implements Controller {

    private static final String BASE = "/api/v1/nodes";
    private static final String PREFIX = BASE + "/";

    private final NodeRegistry nodeRegistry;

    public NodeController(NodeRegistry nodeRegistry) {
        this.nodeRegistry = nodeRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (BASE.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (!path.startsWith(PREFIX)) {
            return false;
        }
        String[] parts = segments(path);
        if (parts.length == 1) {
            return method.equals(HttpMethod.DELETE)
                    || (method.equals(HttpMethod.POST) && "scale".equals(parts[0]));
        }
        return parts.length == 2
                && method.equals(HttpMethod.POST)
                && ("fail".equals(parts[1]) || "recover".equals(parts[1]));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (BASE.equals(path)) {
            return method.equals(HttpMethod.GET) ? handleList() : handleAdd(req);
        }

        String[] parts = segments(path);
        if (parts.length == 1) {
            if (method.equals(HttpMethod.POST)) {
                return handleScale(req);
            }
            return handleRemove(decode(parts[0]));
        }

        String nodeId = decode(parts[0]);
        return "fail".equals(parts[1]) ? handleFail(nodeId) : handleRecover(nodeId);
    }

    private ControllerResponse handleAdd(FullHttpRequest req) throws Exception {
        AddNodeRequest request = RouterHandler.readBody(req, AddNodeRequest.class);
        request.validate();

        Node node = nodeRegistry.register(request.nodeId(), request.cpu());
        return ControllerResponse.created(RouterHandler.mapper().writeValueAsString(NodeResponse.from(node)));
    }

    private ControllerResponse handleScale(FullHttpRequest req) throws Exception {
        ScaleUpRequest request = RouterHandler.readBody(req, ScaleUpRequest.class);
        request.validate();

        List<NodeResponse> created = nodeRegistry.scaleUp(request.count()).stream()
                .map(NodeResponse::from)
                .toList();
        return ControllerResponse.created(RouterHandler.mapper().writeValueAsString(Map.of("nodes", created)));
    }

    private ControllerResponse handleList() throws Exception {
        List<NodeResponse> nodes = nodeRegistry.list().stream()
                .map(NodeResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("nodes", nodes)));
    }

    private ControllerResponse handleRemove(String nodeId) throws Exception {
        List<String> evicted = nodeRegistry.remove(nodeId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                new EvictionResponse(nodeId, evicted)));
    }

    private ControllerResponse handleFail(String nodeId) throws Exception {
        List<String> evicted = nodeRegistry.markUnhealthy(nodeId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                new EvictionResponse(nodeId, evicted)));
    }

    private ControllerResponse handleRecover(String nodeId) throws Exception {
        nodeRegistry.markHealthy(nodeId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                OperationResponse.success("node " + nodeId + " recovered")));
    }

    private static String[] segments(String path) {
        String rest = path.substring(PREFIX.length());
        if (rest.isEmpty()) {
            return new String[0];
        }
        return rest.split("/", -1);
    }

    private static String decode(String segment) {
        return QueryStringDecoder.decodeComponent(segment);
    }
}
