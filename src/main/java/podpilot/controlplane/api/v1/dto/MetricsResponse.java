package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.model.ClusterMetrics;

/**
 * Response DTO for the cluster rollup.
 * GET /api/v1/metrics
 */
public record MetricsResponse(
        @JsonProperty("healthyNodes") int healthyNodes,
        @JsonProperty("totalFreeCpu") long totalFreeCpu,
        @JsonProperty("runningPods") int runningPods,
        @JsonProperty("totalNodes") int totalNodes,
        @JsonProperty("pendingPods") int pendingPods,
        @JsonProperty("strategy") String strategy) {
    public static MetricsResponse from(ClusterMetrics metrics) {
        return new MetricsResponse(
                metrics.healthyNodes(),
                metrics.totalFreeCpu(),
                metrics.runningPods(),
                metrics.totalNodes(),
                metrics.pendingPods(),
                metrics.strategy().wireName());
    }
}
