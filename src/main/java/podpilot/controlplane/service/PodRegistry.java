package podpilot.controlplane.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.exception.DuplicatePodException;
import podpilot.controlplane.exception.InsufficientClusterCapacityException;
import podpilot.controlplane.exception.MissingFieldException;
import podpilot.controlplane.exception.NoFeasibleNodeException;
import podpilot.controlplane.model.LaunchResult;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.model.PodStatus;
import podpilot.controlplane.placement.PlacementStrategy;
import podpilot.controlplane.placement.PodScheduler;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.PodRepository;
import podpilot.controlplane.repository.StateStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for pod operations.
 *
 * Creation runs a cluster-wide admission check first: the free CPU of every node
 * that heartbeated within the liveness window, whatever its recorded status, must
 * cover the request. Passing admission does not mean any single node fits.
 */
public class PodRegistry {

    private static final Logger log = LoggerFactory.getLogger(PodRegistry.class);

    private final NodeRepository nodes;
    private final PodRepository pods;
    private final PodScheduler scheduler;
    private final ClusterSettings settings;
    private final ClusterLock lock;
    private final Clock clock;
    private final Duration livenessWindow;

    public PodRegistry(StateStore store, PodScheduler scheduler, ClusterSettings settings,
            ClusterLock lock, Clock clock, Duration livenessWindow) {
        this.nodes = store.nodes();
        this.pods = store.pods();
        this.scheduler = scheduler;
        this.settings = settings;
        this.lock = lock;
        this.clock = clock;
        this.livenessWindow = livenessWindow;
    }

    /**
     * Create a pending pod after the admission check.
     *
     * @throws DuplicatePodException                if the ID is taken
     * @throws InsufficientClusterCapacityException if live nodes lack the CPU in total
     */
    public Pod create(String podId, int cpuRequest) {
        NodeRegistry.requireId(podId, "pod_id");
        if (cpuRequest <= 0) {
            throw new MissingFieldException("cpu", "cpu must be positive");
        }

        return lock.call(() -> {
            if (pods.exists(podId)) {
                throw new DuplicatePodException(podId);
            }

            Instant now = clock.instant();
            long liveCapacity = nodes.sumAvailableCpuSince(now.minus(livenessWindow));
            if (liveCapacity < cpuRequest) {
                log.warn("Rejected pod {}: requested {} cpu, cluster has {}", podId, cpuRequest, liveCapacity);
                throw new InsufficientClusterCapacityException(podId, cpuRequest, liveCapacity);
            }

            Pod pod = Pod.builder()
                    .id(podId)
                    .cpuRequest(cpuRequest)
                    .createdAt(now)
                    .build();
            pods.insert(pod);
            log.debug("Pod {} created pending ({} cpu)", podId, cpuRequest);
            return pod;
        });
    }

    /**
     * Create a pod and try to place it right away.
     *
     * @param strategyOverride strategy for this launch only, or null for the cluster strategy
     * @throws NoFeasibleNodeException if no single healthy node fits; the pod stays pending
     */
    public LaunchResult launch(String podId, int cpuRequest, PlacementStrategy strategyOverride) {
        return lock.call(() -> {
            Pod pod = create(podId, cpuRequest);
            PlacementStrategy strategy = strategyOverride != null ? strategyOverride : settings.strategy();

            Optional<String> nodeId = scheduler.place(pod.id(), pod.cpuRequest(), strategy);
            if (nodeId.isEmpty()) {
                log.warn("Pod {} left pending: no single node has {} cpu free with {}",
                        podId, cpuRequest, strategy);
                throw new NoFeasibleNodeException(podId, strategy);
            }

            log.info("Pod {} launched on node {} using {}", podId, nodeId.get(), strategy);
            return new LaunchResult(podId, nodeId.get(), strategy);
        });
    }

    public Optional<Pod> find(String podId) {
        return lock.call(() -> pods.findById(podId));
    }

    public List<Pod> list() {
        return lock.call(pods::findAll);
    }

    public List<Pod> pending() {
        return lock.call(pods::findPending);
    }

    public int countByStatus(PodStatus status) {
        return lock.call(() -> pods.countByStatus(status));
    }
}
