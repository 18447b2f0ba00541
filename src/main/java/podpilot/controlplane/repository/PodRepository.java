package podpilot.controlplane.repository;

import podpilot.controlplane.model.Pod;
import podpilot.controlplane.model.PodStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for pod persistence.
 * All list results are in creation order.
 */
public interface PodRepository {

    /**
     * Insert a new pod.
     */
    void insert(Pod pod);

    /**
     * Find a pod by ID.
     */
    Optional<Pod> findById(String podId);

    /**
     * Check whether a pod exists.
     */
    boolean exists(String podId);

    /**
     * Get all pods.
     */
    List<Pod> findAll();

    /**
     * Get pods with no assigned node.
     */
    List<Pod> findPending();

    /**
     * Get pods assigned to a node.
     */
    List<Pod> findByNode(String nodeId);

    /**
     * Atomically deduct the pod's CPU from the node and assign the pod to it.
     * Succeeds only if the node is HEALTHY with enough available CPU and the pod
     * is still pending; otherwise nothing is changed.
     *
     * @param podId      the pod to assign
     * @param nodeId     the target node
     * @param cpuRequest CPU to deduct
     * @param now        scheduling timestamp
     * @return true if the assignment was written
     */
    boolean assign(String podId, String nodeId, int cpuRequest, Instant now);

    /**
     * Get count of pods by status.
     */
    int countByStatus(PodStatus status);
}
