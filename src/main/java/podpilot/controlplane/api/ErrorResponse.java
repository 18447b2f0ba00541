package podpilot.controlplane.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import podpilot.controlplane.exception.ClusterException;

/**
 * Error body returned for every failed request.
 */
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("code") String code) {

    public static ErrorResponse from(ClusterException e) {
        return new ErrorResponse(e.getMessage(), e.code().name());
    }

    public static ErrorResponse of(String error, String code) {
        return new ErrorResponse(error, code);
    }
}
