package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.MissingFieldException;
import podpilot.controlplane.placement.PlacementStrategy;

/**
 * Request DTO for launching a pod.
 * POST /api/v1/pods
 *
 * {@code strategy} is optional; when absent the cluster strategy applies.
 */
public record LaunchPodRequest(
        @JsonProperty("pod_id") String podId,
        @JsonProperty("cpu") Integer cpu,
        @JsonProperty("strategy") String strategy) {

    public void validate() {
        if (podId == null || podId.isBlank()) {
            throw new MissingFieldException("pod_id");
        }
        if (cpu == null) {
            throw new MissingFieldException("cpu");
        }
        if (cpu <= 0) {
            throw new MissingFieldException("cpu", "cpu must be positive");
        }
    }

    /** Per-request strategy, or null to use the cluster setting */
    public PlacementStrategy strategyOverride() {
        if (strategy == null || strategy.isBlank()) {
            return null;
        }
        return PlacementStrategy.fromName(strategy);
    }
}
