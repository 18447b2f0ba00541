package podpilot.controlplane.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.v1.dto.LaunchPodRequest;
import podpilot.controlplane.api.v1.dto.LaunchPodResponse;
import podpilot.controlplane.api.v1.dto.PodResponse;
import podpilot.controlplane.model.LaunchResult;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.PodRegistry;

import java.util.List;
import java.util.Map;

/**
 * Controller for pods (public API).
 * POST /api/v1/pods - Launch pod
 * GET  /api/v1/pods - List pods
 */
public class PodController implements Controller {

    private static final String PATH = "/api/v1/pods";

    private final PodRegistry podRegistry;

    public PodController(PodRegistry podRegistry) {
        this.podRegistry = podRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return PATH.equals(path) && (method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            List<PodResponse> pods = podRegistry.list().stream()
                    .map(PodResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("pods", pods)));
        }

        LaunchPodRequest request = RouterHandler.readBody(req, LaunchPodRequest.class);
        request.validate();

        LaunchResult result = podRegistry.launch(request.podId(), request.cpu(), request.strategyOverride());
        return ControllerResponse.created(RouterHandler.mapper().writeValueAsString(LaunchPodResponse.from(result)));
    }
}
