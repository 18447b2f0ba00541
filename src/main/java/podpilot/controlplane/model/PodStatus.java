package podpilot.controlplane.model;

/**
 * Pod placement status.
 */
public enum PodStatus {
    /** Pod has no node and waits for the rescheduler */
    PENDING("pending"),
    /** Pod is assigned to a node */
    RUNNING("running");

    private final String wireName;

    PodStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
