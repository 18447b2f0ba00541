package podpilot.controlplane.service;

import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.model.ClusterMetrics;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.model.PodStatus;
import podpilot.controlplane.repository.StateStore;

import java.util.List;

/**
 * Read-only rollup of cluster state, taken under the cluster lock so all
 * figures come from the same point in time.
 */
public class MetricsAggregator {

    private final StateStore store;
    private final ClusterSettings settings;
    private final ClusterLock lock;

    public MetricsAggregator(StateStore store, ClusterSettings settings, ClusterLock lock) {
        this.store = store;
        this.settings = settings;
        this.lock = lock;
    }

    public ClusterMetrics snapshot() {
        return lock.call(() -> {
            List<Node> healthy = store.nodes().findByStatus(NodeStatus.HEALTHY);
            long freeCpu = healthy.stream().mapToLong(Node::availableCpu).sum();
            return new ClusterMetrics(
                    healthy.size(),
                    freeCpu,
                    store.pods().countByStatus(PodStatus.RUNNING),
                    store.nodes().count(),
                    store.pods().countByStatus(PodStatus.PENDING),
                    settings.strategy());
        });
    }
}
