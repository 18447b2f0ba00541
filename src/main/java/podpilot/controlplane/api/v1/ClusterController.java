package podpilot.controlplane.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.v1.dto.LeaderResponse;
import podpilot.controlplane.api.v1.dto.MetricsResponse;
import podpilot.controlplane.api.v1.dto.StrategyRequest;
import podpilot.controlplane.api.v1.dto.StrategyResponse;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.ClusterSettings;
import podpilot.controlplane.service.LeaderElector;
import podpilot.controlplane.service.MetricsAggregator;

/**
 * Cluster-wide reads and settings.
 * GET /api/v1/leader
 * GET /api/v1/strategy
 * PUT /api/v1/strategy
 * GET /api/v1/metrics
 */
public class ClusterController implements Controller {

    private static final String LEADER = "/api/v1/leader";
    private static final String STRATEGY = "/api/v1/strategy";
    private static final String METRICS = "/api/v1/metrics";

    private final LeaderElector leaderElector;
    private final ClusterSettings settings;
    private final MetricsAggregator metrics;

    public ClusterController(LeaderElector leaderElector, ClusterSettings settings, MetricsAggregator metrics) {
        this.leaderElector = leaderElector;
        this.settings = settings;
        this.metrics = metrics;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (STRATEGY.equals(path)) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT);
        }
        return method.equals(HttpMethod.GET) && (LEADER.equals(path) || METRICS.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Object response;
        if (LEADER.equals(path)) {
            response = new LeaderResponse(leaderElector.resolveLeader());
        } else if (METRICS.equals(path)) {
            response = MetricsResponse.from(metrics.snapshot());
        } else if (req.method().equals(HttpMethod.PUT)) {
            StrategyRequest request = RouterHandler.readBody(req, StrategyRequest.class);
            request.validate();
            response = StrategyResponse.from(settings.setStrategy(request.strategy()));
        } else {
            response = StrategyResponse.from(settings.strategy());
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
