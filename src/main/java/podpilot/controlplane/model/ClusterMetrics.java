package podpilot.controlplane.model;

import podpilot.controlplane.placement.PlacementStrategy;

/**
 * Point-in-time rollup of cluster capacity and workload.
 *
 * @param healthyNodes number of nodes with HEALTHY status
 * @param totalFreeCpu sum of available CPU over healthy nodes
 * @param runningPods  number of pods assigned to a node
 * @param totalNodes   number of registered nodes, any status
 * @param pendingPods  number of pods waiting for placement
 * @param strategy     placement strategy in effect
 */
public record ClusterMetrics(
        int healthyNodes,
        long totalFreeCpu,
        int runningPods,
        int totalNodes,
        int pendingPods,
        PlacementStrategy strategy) {
}
