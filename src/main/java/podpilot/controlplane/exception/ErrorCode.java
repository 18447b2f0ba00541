package podpilot.controlplane.exception;

/**
 * Stable, caller-visible error codes.
 */
public enum ErrorCode {
    DUPLICATE_NODE,
    DUPLICATE_POD,
    NODE_NOT_FOUND,
    MISSING_FIELD,
    INSUFFICIENT_CLUSTER_CAPACITY,
    NO_FEASIBLE_NODE,
    STORE_FAILURE
}
