package podpilot.controlplane.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void capacitySetsTotalAndAvailable() {
        Node node = Node.builder().id("A").capacity(8).build();

        assertEquals(8, node.totalCpu());
        assertEquals(8, node.availableCpu());
        assertEquals(0, node.allocatedCpu());
        assertTrue(node.isHealthy());
    }

    @Test
    void rejectsAvailableAboveTotal() {
        assertThrows(IllegalArgumentException.class,
                () -> Node.builder().id("A").totalCpu(4).availableCpu(5).build());
    }

    @Test
    void rejectsNegativeAvailable() {
        assertThrows(IllegalArgumentException.class,
                () -> Node.builder().id("A").totalCpu(4).availableCpu(-1).build());
    }

    @Test
    void canFitIsInclusive() {
        Node node = Node.builder().id("A").totalCpu(10).availableCpu(3).build();

        assertTrue(node.canFit(3));
        assertFalse(node.canFit(4));
        assertEquals(7, node.allocatedCpu());
    }

    @Test
    void toBuilderKeepsFields() {
        Instant hb = Instant.parse("2024-01-15T10:00:00Z");
        Node node = Node.builder().id("A").capacity(4).lastHeartbeat(hb).build();

        Node failed = node.toBuilder().status(NodeStatus.UNHEALTHY).build();

        assertEquals("A", failed.id());
        assertEquals(hb, failed.lastHeartbeat());
        assertFalse(failed.isHealthy());
        assertEquals(node, failed, "equality is by id");
    }
}
