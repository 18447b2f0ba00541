package podpilot.controlplane.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.exception.DuplicateNodeException;
import podpilot.controlplane.exception.MissingFieldException;
import podpilot.controlplane.exception.NodeNotFoundException;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.StateStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for node operations.
 * Handles registration, removal, heartbeats and manual fail/recover.
 */
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    static final String SCALE_PREFIX = "node-";

    private final NodeRepository nodes;
    private final ClusterLock lock;
    private final Clock clock;
    private final int defaultNodeCpu;
    private final int maxScaleUp;

    public NodeRegistry(StateStore store, ClusterLock lock, Clock clock, int defaultNodeCpu, int maxScaleUp) {
        this.nodes = store.nodes();
        this.lock = lock;
        this.clock = clock;
        this.defaultNodeCpu = defaultNodeCpu;
        this.maxScaleUp = maxScaleUp;
    }

    /**
     * Register a new healthy node with all of its CPU available.
     *
     * @throws DuplicateNodeException if the ID is taken
     * @throws MissingFieldException if the ID is the reserved no-leader value
     */
    public Node register(String nodeId, int totalCpu) {
        requireId(nodeId, "node_id");
        if (LeaderElector.NO_LEADER.equals(nodeId)) {
            throw new MissingFieldException("node_id", "node_id '" + nodeId + "' is reserved");
        }
        if (totalCpu <= 0) {
            throw new MissingFieldException("cpu", "cpu must be positive");
        }

        return lock.call(() -> {
            if (nodes.exists(nodeId)) {
                throw new DuplicateNodeException(nodeId);
            }
            Node node = newNode(nodeId, totalCpu);
            nodes.insert(node);
            log.info("Node {} added with {} cpu", nodeId, totalCpu);
            return node;
        });
    }

    /**
     * Register {@code count} nodes with the default capacity.
     * IDs are {@code node-<n>} using the lowest free suffixes.
     */
    public List<Node> scaleUp(int count) {
        if (count <= 0) {
            throw new MissingFieldException("count", "count must be positive");
        }
        if (count > maxScaleUp) {
            throw new MissingFieldException("count", "count must be at most " + maxScaleUp);
        }

        return lock.call(() -> {
            List<Node> created = new ArrayList<>(count);
            int suffix = 1;
            while (created.size() < count) {
                String nodeId = SCALE_PREFIX + suffix++;
                if (nodes.exists(nodeId)) {
                    continue;
                }
                Node node = newNode(nodeId, defaultNodeCpu);
                nodes.insert(node);
                created.add(node);
            }
            log.info("Scaled up by {} nodes with {} cpu each", count, defaultNodeCpu);
            return created;
        });
    }

    /**
     * Remove a node. Its pods go back to PENDING in the same step.
     *
     * @return IDs of the evicted pods
     */
    public List<String> remove(String nodeId) {
        requireId(nodeId, "node_id");
        return lock.call(() -> {
            if (!nodes.exists(nodeId)) {
                throw new NodeNotFoundException(nodeId);
            }
            List<String> evicted = nodes.delete(nodeId);
            log.info("Node {} removed, {} pods evicted", nodeId, evicted.size());
            return evicted;
        });
    }

    /**
     * Process a heartbeat: refresh the timestamp and mark the node healthy.
     */
    public void heartbeat(String nodeId) {
        requireId(nodeId, "node_id");
        lock.run(() -> {
            if (!nodes.markHealthy(nodeId, clock.instant())) {
                throw new NodeNotFoundException(nodeId);
            }
        });
        log.debug("Heartbeat from node {}", nodeId);
    }

    /**
     * Manually fail a node and evict its pods.
     *
     * @return IDs of the evicted pods
     */
    public List<String> markUnhealthy(String nodeId) {
        requireId(nodeId, "node_id");
        return lock.call(() -> {
            if (!nodes.exists(nodeId)) {
                throw new NodeNotFoundException(nodeId);
            }
            List<String> evicted = nodes.markUnhealthy(nodeId);
            log.warn("Node {} has been manually marked as failed, {} pods evicted", nodeId, evicted.size());
            return evicted;
        });
    }

    /**
     * Manually recover a node. The heartbeat is refreshed so the failure
     * detector does not fail it again on its next pass.
     */
    public void markHealthy(String nodeId) {
        requireId(nodeId, "node_id");
        lock.run(() -> {
            if (!nodes.markHealthy(nodeId, clock.instant())) {
                throw new NodeNotFoundException(nodeId);
            }
        });
        log.info("Node {} has been manually recovered", nodeId);
    }

    public Optional<Node> find(String nodeId) {
        return lock.call(() -> nodes.findById(nodeId));
    }

    public List<Node> list() {
        return lock.call(nodes::findAll);
    }

    public int countByStatus(NodeStatus status) {
        return lock.call(() -> nodes.countByStatus(status));
    }

    private Node newNode(String nodeId, int cpu) {
        Instant now = clock.instant();
        return Node.builder()
                .id(nodeId)
                .capacity(cpu)
                .status(NodeStatus.HEALTHY)
                .lastHeartbeat(now)
                .registeredAt(now)
                .build();
    }

    static void requireId(String id, String field) {
        if (id == null || id.isBlank()) {
            throw new MissingFieldException(field);
        }
    }
}
