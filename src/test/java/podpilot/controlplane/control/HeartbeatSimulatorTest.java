package podpilot.controlplane.control;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.service.NodeRegistry;
import podpilot.controlplane.testing.ClusterFixture;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatSimulatorTest {

    private ClusterFixture cluster;

    @BeforeEach
    void setUp() {
        cluster = ClusterFixture.create("heartbeat-simulator");
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void keepsNodesAliveAcrossTheTimeout() {
        NodeRegistry nodes = cluster.deps().nodeRegistry();
        nodes.register("A", 4);
        nodes.register("B", 4);

        for (int i = 0; i < 10; i++) {
            cluster.clock().advanceSeconds(5);
            assertEquals(2, cluster.deps().heartbeatSimulator().refreshAll());
        }

        assertTrue(cluster.deps().failureDetector().detectFailures().isEmpty());
        assertEquals(cluster.clock().instant(), cluster.node("A").lastHeartbeat());
    }

    @Test
    void doesNotReviveManuallyFailedNode() {
        NodeRegistry nodes = cluster.deps().nodeRegistry();
        nodes.register("A", 4);
        nodes.markUnhealthy("A");
        cluster.clock().advanceSeconds(5);

        cluster.deps().heartbeatSimulator().refreshAll();

        assertEquals(NodeStatus.UNHEALTHY, cluster.node("A").status());
        assertEquals(cluster.clock().instant(), cluster.node("A").lastHeartbeat());
    }
}
