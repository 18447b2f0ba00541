package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.MissingFieldException;

/**
 * PUT /api/v1/strategy
 */
public record StrategyRequest(
        @JsonProperty("strategy") String strategy) {
    public void validate() {
        if (strategy == null) {
            throw new MissingFieldException("strategy");
        }
    }
}
