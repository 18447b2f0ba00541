package podpilot.controlplane.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic acknowledgement for operations with nothing else to return.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("message") String message) {
    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    public static OperationResponse success(String message) {
        return new OperationResponse(true, message);
    }
}
