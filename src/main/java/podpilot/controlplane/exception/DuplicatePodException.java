package podpilot.controlplane.exception;

/**
 * Exception thrown when creating a pod whose id is already taken
 */
public class DuplicatePodException extends ClusterException {

    public DuplicatePodException(String podId) {
        super(ErrorCode.DUPLICATE_POD, "Pod " + podId + " already exists");
    }
}
