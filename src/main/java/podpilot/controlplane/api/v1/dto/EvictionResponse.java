package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pods returned to PENDING by a node failure or removal.
 */
public record EvictionResponse(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("evictedPods") List<String> evictedPods) {
}
