package podpilot.controlplane.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a worker node and its CPU capacity.
 */
public final class Node {
    private final String id;
    private final int totalCpu;
    private final int availableCpu;
    private final NodeStatus status;
    private final Instant lastHeartbeat;
    private final Instant registeredAt;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.totalCpu < 0) {
            throw new IllegalArgumentException("totalCpu must be non-negative");
        }
        if (builder.availableCpu < 0 || builder.availableCpu > builder.totalCpu) {
            throw new IllegalArgumentException(
                    "availableCpu must be within [0, " + builder.totalCpu + "], was " + builder.availableCpu);
        }
        this.totalCpu = builder.totalCpu;
        this.availableCpu = builder.availableCpu;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.registeredAt = builder.registeredAt;
    }

    public String id() {
        return id;
    }

    public int totalCpu() {
        return totalCpu;
    }

    public int availableCpu() {
        return availableCpu;
    }

    /** CPU currently held by pods assigned to this node */
    public int allocatedCpu() {
        return totalCpu - availableCpu;
    }

    public NodeStatus status() {
        return status;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public boolean isHealthy() {
        return status == NodeStatus.HEALTHY;
    }

    /** Check if a pod requesting the given CPU would fit right now */
    public boolean canFit(int cpuRequest) {
        return availableCpu >= cpuRequest;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .totalCpu(totalCpu)
                .availableCpu(availableCpu)
                .status(status)
                .lastHeartbeat(lastHeartbeat)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int totalCpu;
        private int availableCpu;
        private NodeStatus status = NodeStatus.HEALTHY;
        private Instant lastHeartbeat;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder totalCpu(int totalCpu) {
            this.totalCpu = totalCpu;
            return this;
        }

        public Builder availableCpu(int availableCpu) {
            this.availableCpu = availableCpu;
            return this;
        }

        /** Shortcut for a freshly registered node: total and available both set */
        public Builder capacity(int cpu) {
            this.totalCpu = cpu;
            this.availableCpu = cpu;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Node node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', status=" + status + ", cpu=" + availableCpu + "/" + totalCpu + "}";
    }
}
