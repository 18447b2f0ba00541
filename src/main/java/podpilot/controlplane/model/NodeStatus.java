package podpilot.controlplane.model;

/**
 * Node health status.
 */
public enum NodeStatus {
    /** Node is heartbeating and eligible for placement */
    HEALTHY("healthy"),
    /** Node timed out or was failed manually; hosts no pods */
    UNHEALTHY("unhealthy");

    private final String wireName;

    NodeStatus(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in API responses */
    public String wireName() {
        return wireName;
    }
}
