package podpilot.controlplane.exception;

import podpilot.controlplane.placement.PlacementStrategy;

/**
 * Exception thrown when admission passed but no single healthy node can host the pod.
 * The pod has been stored and stays PENDING; the rescheduler keeps retrying it.
 */
public class NoFeasibleNodeException extends ClusterException {

    private final String podId;
    private final PlacementStrategy strategy;

    public NoFeasibleNodeException(String podId, PlacementStrategy strategy) {
        super(ErrorCode.NO_FEASIBLE_NODE,
                "No single node has enough resources right now with " + strategy.wireName()
                        + "; pod " + podId + " left pending");
        this.podId = podId;
        this.strategy = strategy;
    }

    public String podId() {
        return podId;
    }

    public PlacementStrategy strategy() {
        return strategy;
    }
}
