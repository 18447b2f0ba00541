package podpilot.controlplane.control;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import podpilot.controlplane.config.ControlPlaneConfig;
import podpilot.controlplane.testing.ClusterFixture;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the real executor with short intervals.
 */
class ControlLoopTest {

    private ClusterFixture cluster;

    @AfterEach
    void tearDown() {
        if (cluster != null) {
            cluster.close();
        }
    }

    private static ControlPlaneConfig fastConfig(String name) {
        return ClusterFixture.config(name)
                .withFailureDetectorInterval(Duration.ofMillis(50))
                .withReschedulerInterval(Duration.ofMillis(50))
                .withHeartbeatRefreshInterval(Duration.ofMillis(20));
    }

    private static boolean waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }

    @Test
    void failsSilentNodeAndReschedulesItsPod() throws Exception {
        cluster = ClusterFixture.create(fastConfig("control-loop"));
        cluster.deps().nodeRegistry().register("A", 4);
        cluster.deps().podRegistry().launch("p1", 2, null);
        cluster.clock().advanceSeconds(31);
        cluster.deps().nodeRegistry().register("B", 4);

        cluster.deps().startControlLoop();
        assertTrue(cluster.deps().controlLoop().isRunning());

        assertTrue(waitFor(() -> "B".equals(cluster.pod("p1").assignedNode())),
                "pod should be moved to the live node");
        assertFalse(cluster.node("A").isHealthy());

        cluster.deps().stopControlLoop();
        assertFalse(cluster.deps().controlLoop().isRunning());
        cluster.assertConsistent();
    }

    @Test
    void simulatedHeartbeatsKeepNodesHealthy() throws Exception {
        cluster = ClusterFixture.create(fastConfig("control-loop-sim").withHeartbeatSimulator(true));
        cluster.deps().nodeRegistry().register("A", 4);
        cluster.clock().advanceSeconds(31);

        cluster.deps().startControlLoop();

        assertTrue(waitFor(() -> cluster.clock().instant().equals(cluster.node("A").lastHeartbeat())));
        Thread.sleep(200);
        assertTrue(cluster.node("A").isHealthy());
    }

    @Test
    void startTwiceAndStopTwiceAreHarmless() {
        cluster = ClusterFixture.create(fastConfig("control-loop-idem"));
        ControlLoop loop = cluster.deps().controlLoop();

        loop.start();
        loop.start();
        loop.stop();
        loop.close();

        assertFalse(loop.isRunning());
    }
}
