package podpilot.controlplane.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.api.Controller;
import podpilot.controlplane.api.v1.dto.HealthResponse;
import podpilot.controlplane.model.ClusterMetrics;
import podpilot.controlplane.repository.StateStore;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.MetricsAggregator;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final StateStore store;
    private final MetricsAggregator metrics;

    public HealthController(StateStore store, MetricsAggregator metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!store.isHealthy()) {
            return ControllerResponse.unavailable(
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }

        try {
            ClusterMetrics snapshot = metrics.snapshot();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION,
                    snapshot.healthyNodes(), snapshot.pendingPods(), snapshot.runningPods());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable(
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
