package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.model.Pod;

import java.time.Instant;

/**
 * Response DTO for pod information. {@code nodeId} is omitted while pending.
 * GET /api/v1/pods
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PodResponse(
        @JsonProperty("podId") String podId,
        @JsonProperty("cpu") int cpu,
        @JsonProperty("status") String status,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("scheduledAt") Instant scheduledAt) {
    public static PodResponse from(Pod pod) {
        return new PodResponse(
                pod.id(),
                pod.cpuRequest(),
                pod.status().wireName(),
                pod.assignedNode(),
                pod.createdAt(),
                pod.scheduledAt());
    }
}
