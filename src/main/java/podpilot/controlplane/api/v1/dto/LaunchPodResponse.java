package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.model.LaunchResult;
import podpilot.controlplane.model.PodStatus;

/**
 * Response DTO for a successful launch.
 * POST /api/v1/pods
 */
public record LaunchPodResponse(
        @JsonProperty("podId") String podId,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("status") String status,
        @JsonProperty("strategy") String strategy) {
    public static LaunchPodResponse from(LaunchResult result) {
        return new LaunchPodResponse(
                result.podId(),
                result.nodeId(),
                PodStatus.RUNNING.wireName(),
                result.strategy().wireName());
    }
}
