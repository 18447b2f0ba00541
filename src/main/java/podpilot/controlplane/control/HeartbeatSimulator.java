package podpilot.controlplane.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.StateStore;

import java.time.Clock;

/**
 * Stands in for node agents: refreshes the heartbeat of every registered node.
 * Node status is left alone, so a manually failed node stays unhealthy.
 */
public class HeartbeatSimulator implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatSimulator.class);

    private final NodeRepository nodes;
    private final ClusterLock lock;
    private final Clock clock;

    public HeartbeatSimulator(StateStore store, ClusterLock lock, Clock clock) {
        this.nodes = store.nodes();
        this.lock = lock;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            refreshAll();
        } catch (Exception e) {
            log.error("Heartbeat simulator error", e);
        }
    }

    /**
     * @return number of nodes refreshed
     */
    public int refreshAll() {
        int refreshed = lock.call(() -> nodes.touchAll(clock.instant()));
        log.trace("Simulated heartbeat for {} nodes", refreshed);
        return refreshed;
    }
}
