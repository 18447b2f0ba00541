package podpilot.controlplane.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a pod: a unit of CPU demand.
 * A pod is RUNNING exactly when it carries an assigned node.
 */
public final class Pod {
    private final String id;
    private final int cpuRequest;
    private final String assignedNode;
    private final PodStatus status;
    private final Instant createdAt;
    private final Instant scheduledAt;

    private Pod(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.cpuRequest = builder.cpuRequest;
        this.assignedNode = builder.assignedNode;
        this.status = builder.assignedNode != null ? PodStatus.RUNNING : PodStatus.PENDING;
        this.createdAt = builder.createdAt;
        this.scheduledAt = builder.assignedNode != null ? builder.scheduledAt : null;
    }

    public String id() {
        return id;
    }

    public int cpuRequest() {
        return cpuRequest;
    }

    /** Node this pod runs on, or null while pending */
    public String assignedNode() {
        return assignedNode;
    }

    public PodStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public boolean isPending() {
        return status == PodStatus.PENDING;
    }

    public boolean isRunning() {
        return status == PodStatus.RUNNING;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .cpuRequest(cpuRequest)
                .assignedNode(assignedNode)
                .createdAt(createdAt)
                .scheduledAt(scheduledAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int cpuRequest;
        private String assignedNode;
        private Instant createdAt;
        private Instant scheduledAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder cpuRequest(int cpuRequest) {
            this.cpuRequest = cpuRequest;
            return this;
        }

        public Builder assignedNode(String assignedNode) {
            this.assignedNode = assignedNode;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Pod build() {
            return new Pod(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pod pod))
            return false;
        return Objects.equals(id, pod.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Pod{id='" + id + "', cpu=" + cpuRequest + ", status=" + status
                + (assignedNode != null ? ", node='" + assignedNode + "'" : "") + "}";
    }
}
