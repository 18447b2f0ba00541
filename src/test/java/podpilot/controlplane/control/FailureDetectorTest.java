package podpilot.controlplane.control;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.service.NodeRegistry;
import podpilot.controlplane.service.PodRegistry;
import podpilot.controlplane.testing.ClusterFixture;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FailureDetector on a manual clock.
 */
class FailureDetectorTest {

    private ClusterFixture cluster;
    private NodeRegistry nodes;
    private PodRegistry pods;
    private FailureDetector detector;

    @BeforeEach
    void setUp() {
        cluster = ClusterFixture.create("failure-detector");
        nodes = cluster.deps().nodeRegistry();
        pods = cluster.deps().podRegistry();
        detector = cluster.deps().failureDetector();
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void doesNotFailNodesWithinTimeout() {
        nodes.register("A", 4);
        cluster.clock().advanceSeconds(30);

        assertTrue(detector.detectFailures().isEmpty());
        assertTrue(cluster.node("A").isHealthy());
    }

    @Test
    void failsSilentNodesAndEvictsTheirPods() {
        nodes.register("A", 4);
        nodes.register("B", 4);
        pods.launch("p1", 3, null);
        assertEquals("A", cluster.pod("p1").assignedNode());

        cluster.clock().advanceSeconds(20);
        nodes.heartbeat("B");
        cluster.clock().advanceSeconds(15);

        List<String> failed = detector.detectFailures();

        assertEquals(List.of("A"), failed);
        assertEquals(NodeStatus.UNHEALTHY, cluster.node("A").status());
        assertTrue(cluster.node("B").isHealthy());
        assertTrue(cluster.pod("p1").isPending());
        assertEquals(4, cluster.node("A").availableCpu());
        cluster.assertConsistent();
    }

    @Test
    void alreadyFailedNodesAreNotReported() {
        nodes.register("A", 4);
        nodes.markUnhealthy("A");
        cluster.clock().advanceSeconds(60);

        assertTrue(detector.detectFailures().isEmpty());
    }

    @Test
    void heartbeatAfterFailureRestoresNode() {
        nodes.register("A", 4);
        cluster.clock().advanceSeconds(31);
        detector.detectFailures();

        nodes.heartbeat("A");

        assertTrue(cluster.node("A").isHealthy());
        assertTrue(detector.detectFailures().isEmpty());
    }
}
