package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.MissingFieldException;

/**
 * Request DTO for registering a node.
 * POST /api/v1/nodes
 */
public record AddNodeRequest(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("cpu") Integer cpu) {
    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new MissingFieldException("node_id");
        }
        if (cpu == null) {
            throw new MissingFieldException("cpu");
        }
        if (cpu <= 0) {
            throw new MissingFieldException("cpu", "cpu must be positive");
        }
    }
}
