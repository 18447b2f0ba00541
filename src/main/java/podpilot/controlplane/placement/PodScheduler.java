package podpilot.controlplane.placement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.repository.StateStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Places a pod on a healthy node.
 *
 * Selection reads the healthy nodes and writes the CPU deduction plus the pod
 * assignment while holding the cluster lock, so no other operation can observe
 * or act on a half-applied placement.
 */
public class PodScheduler {

    private static final Logger log = LoggerFactory.getLogger(PodScheduler.class);

    private final StateStore store;
    private final ClusterLock lock;
    private final Clock clock;

    public PodScheduler(StateStore store, ClusterLock lock, Clock clock) {
        this.store = store;
        this.lock = lock;
        this.clock = clock;
    }

    /**
     * Select a node for the pod and assign it.
     *
     * @param podId      a pending pod
     * @param cpuRequest the pod's CPU request
     * @param strategy   placement policy
     * @return the chosen node ID, or empty if no healthy node fits
     */
    public Optional<String> place(String podId, int cpuRequest, PlacementStrategy strategy) {
        return lock.call(() -> {
            List<Node> healthy = store.nodes().findByStatus(NodeStatus.HEALTHY);
            Optional<Node> chosen = strategy.select(healthy, cpuRequest);

            if (chosen.isEmpty()) {
                log.debug("No healthy node fits pod {} ({} cpu) with {} across {} candidates",
                        podId, cpuRequest, strategy, healthy.size());
                return Optional.empty();
            }

            Node node = chosen.get();
            if (!store.pods().assign(podId, node.id(), cpuRequest, clock.instant())) {
                log.warn("Assignment of pod {} to node {} was rejected by the store", podId, node.id());
                return Optional.empty();
            }

            log.info("Pod {} placed on node {} using {} ({} cpu left)",
                    podId, node.id(), strategy, node.availableCpu() - cpuRequest);
            return Optional.of(node.id());
        });
    }
}
