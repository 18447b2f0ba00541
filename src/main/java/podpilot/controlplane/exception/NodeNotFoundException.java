package podpilot.controlplane.exception;

/**
 * Exception thrown when a node id does not exist
 */
public class NodeNotFoundException extends ClusterException {

    public NodeNotFoundException(String nodeId) {
        super(ErrorCode.NODE_NOT_FOUND, "Node not found: " + nodeId);
    }
}
