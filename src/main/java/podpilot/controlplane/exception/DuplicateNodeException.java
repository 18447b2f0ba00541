package podpilot.controlplane.exception;

/**
 * Exception thrown when registering a node whose id is already taken
 */
public class DuplicateNodeException extends ClusterException {

    public DuplicateNodeException(String nodeId) {
        super(ErrorCode.DUPLICATE_NODE, "Node " + nodeId + " already exists");
    }
}
