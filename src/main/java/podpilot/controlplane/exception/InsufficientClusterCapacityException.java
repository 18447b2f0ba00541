package podpilot.controlplane.exception;

/**
 * Exception thrown when the cluster-wide admission check rejects a pod:
 * the free CPU of all recently heartbeating nodes is below the request.
 */
public class InsufficientClusterCapacityException extends ClusterException {

    private final int requested;
    private final long available;

    public InsufficientClusterCapacityException(String podId, int requested, long available) {
        super(ErrorCode.INSUFFICIENT_CLUSTER_CAPACITY,
                "Insufficient cluster-wide resources to schedule pod " + podId
                        + " (requested " + requested + ", available " + available + ")");
        this.requested = requested;
        this.available = available;
    }

    public int requested() {
        return requested;
    }

    public long available() {
        return available;
    }
}
