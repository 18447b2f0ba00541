package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.MissingFieldException;

/**
 * Request DTO for adding several default-sized nodes.
 * POST /api/v1/nodes/scale
 */
public record ScaleUpRequest(
        @JsonProperty("count") Integer count) {
    public void validate() {
        if (count == null) {
            throw new MissingFieldException("count");
        }
        if (count <= 0) {
            throw new MissingFieldException("count", "count must be positive");
        }
    }
}
