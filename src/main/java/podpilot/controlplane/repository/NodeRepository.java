package podpilot.controlplane.repository;

import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for node persistence.
 * All list results are in registry order (order of registration).
 */
public interface NodeRepository {

    /**
     * Insert a new node.
     *
     * @param node the node to insert
     */
    void insert(Node node);

    /**
     * Find a node by ID.
     *
     * @param nodeId the node ID
     * @return the node if found
     */
    Optional<Node> findById(String nodeId);

    /**
     * Check whether a node exists.
     */
    boolean exists(String nodeId);

    /**
     * Get all nodes.
     */
    List<Node> findAll();

    /**
     * Get all nodes with the given status.
     */
    List<Node> findByStatus(NodeStatus status);

    /**
     * Mark a node HEALTHY and refresh its heartbeat.
     *
     * @param nodeId the node ID
     * @param now    new heartbeat timestamp
     * @return true if the node exists
     */
    boolean markHealthy(String nodeId, Instant now);

    /**
     * Mark a node UNHEALTHY and, in the same transaction, evict every pod
     * assigned to it and credit their CPU back to the node.
     *
     * @param nodeId the node ID
     * @return IDs of the evicted pods
     */
    List<String> markUnhealthy(String nodeId);

    /**
     * Delete a node. Pods assigned to it are evicted in the same transaction.
     *
     * @param nodeId the node ID
     * @return IDs of the evicted pods
     */
    List<String> delete(String nodeId);

    /**
     * Find HEALTHY nodes whose last heartbeat is strictly before the cutoff.
     *
     * @param cutoff heartbeat threshold
     * @return IDs of stale nodes
     */
    List<String> findStale(Instant cutoff);

    /**
     * Set the heartbeat of every node to the given time. Status is untouched.
     *
     * @return number of nodes updated
     */
    int touchAll(Instant now);

    /**
     * Sum available CPU over nodes whose last heartbeat is at or after the cutoff,
     * regardless of recorded status.
     */
    long sumAvailableCpuSince(Instant cutoff);

    /**
     * Get total count of nodes.
     */
    int count();

    /**
     * Get count of nodes by status.
     */
    int countByStatus(NodeStatus status);
}
