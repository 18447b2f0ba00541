package podpilot.controlplane.testing;

import podpilot.controlplane.config.ControlPlaneConfig;
import podpilot.controlplane.config.Dependencies;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.repository.StateStore;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Fully wired control plane on a private in-memory database and a manual clock.
 */
public final class ClusterFixture implements AutoCloseable {

    private final MutableClock clock;
    private final Dependencies deps;

    private ClusterFixture(ControlPlaneConfig config) {
        this.clock = MutableClock.startingAt("2024-01-15T10:00:00Z");
        this.deps = Dependencies.create(config, clock);
    }

    public static ClusterFixture create(String name) {
        return new ClusterFixture(config(name));
    }

    public static ClusterFixture create(ControlPlaneConfig config) {
        return new ClusterFixture(config);
    }

    /** Test config: unique in-memory database, no simulated heartbeats */
    public static ControlPlaneConfig config(String name) {
        return ControlPlaneConfig.defaults()
                .withDatabaseUrl(memoryUrl(name))
                .withHeartbeatSimulator(false);
    }

    public static String memoryUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public MutableClock clock() {
        return clock;
    }

    public Dependencies deps() {
        return deps;
    }

    public StateStore store() {
        return deps.store();
    }

    public Node node(String nodeId) {
        return store().nodes().findById(nodeId).orElseThrow();
    }

    public Pod pod(String podId) {
        return store().pods().findById(podId).orElseThrow();
    }

    /**
     * Check the capacity bookkeeping of every node against the pods placed on it.
     */
    public void assertConsistent() {
        assertConsistent(store());
    }

    public static void assertConsistent(StateStore store) {
        List<Pod> pods = store.pods().findAll();
        for (Node node : store.nodes().findAll()) {
            int allocated = pods.stream()
                    .filter(p -> node.id().equals(p.assignedNode()))
                    .mapToInt(Pod::cpuRequest)
                    .sum();
            assertEquals(node.totalCpu() - allocated, node.availableCpu(),
                    "available cpu of " + node.id() + " out of sync with its pods");
            assertTrue(node.availableCpu() >= 0 && node.availableCpu() <= node.totalCpu());
        }
        for (Pod pod : pods) {
            if (pod.isRunning()) {
                assertNotNull(pod.assignedNode());
                assertTrue(store.nodes().exists(pod.assignedNode()),
                        "pod " + pod.id() + " points at missing node " + pod.assignedNode());
            } else {
                assertNull(pod.assignedNode());
            }
        }
    }

    @Override
    public void close() {
        deps.close();
    }
}
