package podpilot.controlplane.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import podpilot.controlplane.exception.DuplicateNodeException;
import podpilot.controlplane.exception.ErrorCode;
import podpilot.controlplane.exception.MissingFieldException;
import podpilot.controlplane.exception.NodeNotFoundException;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.testing.ClusterFixture;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeRegistryTest {

    private ClusterFixture cluster;
    private NodeRegistry registry;

    @BeforeEach
    void setUp() {
        cluster = ClusterFixture.create("node-registry");
        registry = cluster.deps().nodeRegistry();
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void registerCreatesHealthyNodeWithAllCpuFree() {
        Node node = registry.register("A", 8);

        assertEquals(8, node.totalCpu());
        assertEquals(8, node.availableCpu());
        assertEquals(NodeStatus.HEALTHY, node.status());
        assertEquals(cluster.clock().instant(), node.lastHeartbeat());
        assertEquals(node.lastHeartbeat(), cluster.node("A").lastHeartbeat());
    }

    @Test
    void duplicateRegistrationLeavesOriginalUntouched() {
        registry.register("A", 8);

        DuplicateNodeException e = assertThrows(DuplicateNodeException.class, () -> registry.register("A", 2));

        assertEquals(ErrorCode.DUPLICATE_NODE, e.code());
        assertEquals(8, cluster.node("A").totalCpu());
    }

    @Test
    void registerValidatesInput() {
        MissingFieldException noId = assertThrows(MissingFieldException.class, () -> registry.register(" ", 4));
        assertEquals("node_id", noId.field());

        MissingFieldException noCpu = assertThrows(MissingFieldException.class, () -> registry.register("A", 0));
        assertEquals("cpu", noCpu.field());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void scaleUpUsesLowestFreeSuffixes() {
        registry.register("node-2", 16);

        List<Node> created = registry.scaleUp(3);

        assertEquals(List.of("node-1", "node-3", "node-4"), created.stream().map(Node::id).toList());
        assertTrue(created.stream().allMatch(n -> n.totalCpu() == cluster.deps().config().defaultNodeCpu()));
        assertEquals(4, registry.list().size());
    }

    @Test
    void scaleUpRejectsCountAboveLimit() {
        int limit = cluster.deps().config().maxScaleUp();

        MissingFieldException e = assertThrows(MissingFieldException.class, () -> registry.scaleUp(limit + 1));
        assertEquals("count", e.field());
        assertThrows(MissingFieldException.class, () -> registry.scaleUp(Integer.MAX_VALUE));
        assertTrue(registry.list().isEmpty());

        assertEquals(limit, registry.scaleUp(limit).size());
    }

    @Test
    void noLeaderSentinelCannotBeANodeId() {
        MissingFieldException e = assertThrows(MissingFieldException.class,
                () -> registry.register(LeaderElector.NO_LEADER, 4));

        assertEquals("node_id", e.field());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void heartbeatUnknownNodeIsRejected() {
        assertThrows(NodeNotFoundException.class, () -> registry.heartbeat("ghost"));
        assertTrue(registry.list().isEmpty(), "heartbeat must not create nodes");
    }

    @Test
    void heartbeatRevivesFailedNode() {
        registry.register("A", 4);
        registry.markUnhealthy("A");
        cluster.clock().advanceSeconds(12);

        registry.heartbeat("A");

        Node a = cluster.node("A");
        assertTrue(a.isHealthy());
        assertEquals(cluster.clock().instant(), a.lastHeartbeat());
    }

    @Test
    void failAndRecoverUnknownNode() {
        assertThrows(NodeNotFoundException.class, () -> registry.markUnhealthy("ghost"));
        assertThrows(NodeNotFoundException.class, () -> registry.markHealthy("ghost"));
        assertThrows(NodeNotFoundException.class, () -> registry.remove("ghost"));
    }

    @Test
    void removeEvictsPodsAtomically() {
        registry.register("A", 4);
        registry.register("B", 4);
        cluster.deps().podRegistry().launch("p1", 3, null);

        assertEquals("A", cluster.pod("p1").assignedNode());

        List<String> evicted = registry.remove("A");

        assertEquals(List.of("p1"), evicted);
        assertTrue(cluster.pod("p1").isPending());
        assertEquals(List.of("B"), registry.list().stream().map(Node::id).toList());
        cluster.assertConsistent();
    }

    @Test
    void listKeepsRegistrationOrder() {
        registry.register("c", 1);
        registry.register("a", 1);
        registry.register("b", 1);

        assertEquals(List.of("c", "a", "b"), registry.list().stream().map(Node::id).toList());
        assertEquals(3, registry.countByStatus(NodeStatus.HEALTHY));
    }
}
