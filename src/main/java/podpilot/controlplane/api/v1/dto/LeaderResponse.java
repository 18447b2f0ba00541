package podpilot.controlplane.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /api/v1/leader. {@code leader} is "none" when no node is healthy.
 */
public record LeaderResponse(@JsonProperty("leader") String leader) {
}
