package podpilot.controlplane.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.StateStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Background task that turns node silence into rescheduling eligibility.
 *
 * Each pass:
 * 1. Finds HEALTHY nodes whose last heartbeat is older than the liveness window
 * 2. Marks each one UNHEALTHY and evicts its pods in the same step
 *
 * Evicted pods are picked up by the {@link Rescheduler}.
 */
public class FailureDetector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    private final NodeRepository nodes;
    private final ClusterLock lock;
    private final Clock clock;
    private final Duration livenessWindow;

    public FailureDetector(StateStore store, ClusterLock lock, Clock clock, Duration livenessWindow) {
        this.nodes = store.nodes();
        this.lock = lock;
        this.clock = clock;
        this.livenessWindow = livenessWindow;
    }

    @Override
    public void run() {
        try {
            detectFailures();
        } catch (Exception e) {
            log.error("Failure detector error", e);
        }
    }

    /**
     * Fail every stale healthy node.
     *
     * @return IDs of the nodes marked unhealthy
     */
    public List<String> detectFailures() {
        return lock.call(() -> {
            Instant cutoff = clock.instant().minus(livenessWindow);
            List<String> stale = nodes.findStale(cutoff);

            if (stale.isEmpty()) {
                log.debug("No stale nodes found");
                return stale;
            }

            List<String> failed = new ArrayList<>(stale.size());
            int evictedTotal = 0;

            for (String nodeId : stale) {
                try {
                    List<String> evicted = nodes.markUnhealthy(nodeId);
                    failed.add(nodeId);
                    evictedTotal += evicted.size();
                    log.warn("Node {} failed! No heartbeat since before {}, evicted pods {}",
                            nodeId, cutoff, evicted);
                } catch (Exception e) {
                    log.error("Failed to mark node {} unhealthy", nodeId, e);
                }
            }

            log.info("Failure detector: {} nodes failed, {} pods evicted", failed.size(), evictedTotal);
            return failed;
        });
    }
}
