package podpilot.controlplane.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.placement.PlacementStrategy;
import podpilot.controlplane.placement.PodScheduler;
import podpilot.controlplane.repository.PodRepository;
import podpilot.controlplane.repository.StateStore;
import podpilot.controlplane.service.ClusterSettings;

import java.util.List;
import java.util.Optional;

/**
 * Background task that retries placement of every pending pod.
 *
 * This is the only retry path. Pods that still do not fit stay pending and are
 * tried again on the next pass, with no backoff and no attempt limit.
 */
public class Rescheduler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Rescheduler.class);

    private final PodRepository pods;
    private final PodScheduler scheduler;
    private final ClusterSettings settings;
    private final ClusterLock lock;

    public Rescheduler(StateStore store, PodScheduler scheduler, ClusterSettings settings, ClusterLock lock) {
        this.pods = store.pods();
        this.scheduler = scheduler;
        this.settings = settings;
        this.lock = lock;
    }

    @Override
    public void run() {
        try {
            reschedulePending();
        } catch (Exception e) {
            log.error("Rescheduler error", e);
        }
    }

    /**
     * Try to place all pending pods with the current cluster strategy.
     *
     * @return number of pods placed
     */
    public int reschedulePending() {
        return lock.call(() -> {
            List<Pod> pending = pods.findPending();
            if (pending.isEmpty()) {
                log.debug("No pending pods");
                return 0;
            }

            PlacementStrategy strategy = settings.strategy();
            int placed = 0;

            for (Pod pod : pending) {
                try {
                    Optional<String> nodeId = scheduler.place(pod.id(), pod.cpuRequest(), strategy);
                    if (nodeId.isPresent()) {
                        placed++;
                        log.info("Rescheduled pod {} to node {} using {}", pod.id(), nodeId.get(), strategy);
                    }
                } catch (Exception e) {
                    log.error("Failed to reschedule pod {}", pod.id(), e);
                }
            }

            if (placed < pending.size()) {
                log.info("Rescheduler: {} placed, {} still pending", placed, pending.size() - placed);
            }
            return placed;
        });
    }
}
