package podpilot.controlplane.model;

import podpilot.controlplane.placement.PlacementStrategy;

/**
 * Outcome of a successful pod launch.
 */
public record LaunchResult(String podId, String nodeId, PlacementStrategy strategy) {
}
