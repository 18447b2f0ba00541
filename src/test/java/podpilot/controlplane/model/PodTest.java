package podpilot.controlplane.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PodTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void podWithoutNodeIsPending() {
        Pod pod = Pod.builder().id("p1").cpuRequest(2).createdAt(NOW).scheduledAt(NOW).build();

        assertEquals(PodStatus.PENDING, pod.status());
        assertTrue(pod.isPending());
        assertNull(pod.assignedNode());
        assertNull(pod.scheduledAt(), "pending pods carry no schedule time");
    }

    @Test
    void podWithNodeIsRunning() {
        Pod pod = Pod.builder().id("p1").cpuRequest(2).assignedNode("A").scheduledAt(NOW).build();

        assertEquals(PodStatus.RUNNING, pod.status());
        assertTrue(pod.isRunning());
        assertEquals("A", pod.assignedNode());
        assertEquals(NOW, pod.scheduledAt());
    }

    @Test
    void clearingNodeMakesPodPendingAgain() {
        Pod running = Pod.builder().id("p1").cpuRequest(2).assignedNode("A").scheduledAt(NOW).build();

        Pod evicted = running.toBuilder().assignedNode(null).build();

        assertTrue(evicted.isPending());
        assertNull(evicted.scheduledAt());
    }

    @Test
    void idIsRequired() {
        assertThrows(NullPointerException.class, () -> Pod.builder().cpuRequest(1).build());
    }
}
