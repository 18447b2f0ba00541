package podpilot.controlplane.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.MissingFieldException;

/**
 * Request DTO for node heartbeat.
 * POST /internal/v1/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("node_id") String nodeId) {
    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new MissingFieldException("node_id");
        }
    }
}
