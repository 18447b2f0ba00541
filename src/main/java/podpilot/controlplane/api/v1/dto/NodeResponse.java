package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.model.Node;

import java.time.Instant;

/**
 * Response DTO for node information.
 * GET /api/v1/nodes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResponse(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("status") String status,
        @JsonProperty("totalCpu") int totalCpu,
        @JsonProperty("availableCpu") int availableCpu,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat) {
    /** Create response from domain model */
    public static NodeResponse from(Node node) {
        return new NodeResponse(
                node.id(),
                node.status().wireName(),
                node.totalCpu(),
                node.availableCpu(),
                node.lastHeartbeat());
    }
}
