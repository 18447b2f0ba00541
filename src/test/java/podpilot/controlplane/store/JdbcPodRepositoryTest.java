package podpilot.controlplane.store;

import org.junit.jupiter.api.*;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.model.PodStatus;
import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.PodRepository;
import podpilot.controlplane.testing.ClusterFixture;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcPodRepository, mainly the guarded assignment.
 */
class JdbcPodRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private static Database db;
    private static JdbcStateStore store;
    private static NodeRepository nodes;
    private static PodRepository pods;

    @BeforeAll
    static void setup() {
        db = new Database(ClusterFixture.memoryUrl("pod-repo"), 4, true);
        store = new JdbcStateStore(db);
        nodes = store.nodes();
        pods = store.pods();
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM pods");
            st.execute("DELETE FROM nodes");
            conn.commit();
        }
        nodes.insert(Node.builder().id("A").capacity(4).lastHeartbeat(T0).build());
    }

    private static void pending(String podId, int cpu) {
        pods.insert(Pod.builder().id(podId).cpuRequest(cpu).createdAt(T0).build());
    }

    @Test
    void assignDeductsCpuAndMarksRunning() {
        pending("p1", 3);

        assertTrue(pods.assign("p1", "A", 3, T0.plusSeconds(1)));

        Pod p1 = pods.findById("p1").orElseThrow();
        assertEquals(PodStatus.RUNNING, p1.status());
        assertEquals("A", p1.assignedNode());
        assertEquals(T0.plusSeconds(1), p1.scheduledAt());
        assertEquals(1, nodes.findById("A").orElseThrow().availableCpu());
        ClusterFixture.assertConsistent(store);
    }

    @Test
    void assignRefusesWhenNodeLacksCpu() {
        pending("p1", 5);

        assertFalse(pods.assign("p1", "A", 5, T0));

        assertTrue(pods.findById("p1").orElseThrow().isPending());
        assertEquals(4, nodes.findById("A").orElseThrow().availableCpu());
    }

    @Test
    void assignRefusesUnhealthyNode() {
        pending("p1", 1);
        nodes.markUnhealthy("A");

        assertFalse(pods.assign("p1", "A", 1, T0));
        assertEquals(4, nodes.findById("A").orElseThrow().availableCpu());
    }

    @Test
    void assignRefusesPodThatIsAlreadyRunning() {
        pending("p1", 1);
        assertTrue(pods.assign("p1", "A", 1, T0));

        assertFalse(pods.assign("p1", "A", 1, T0));

        assertEquals(3, nodes.findById("A").orElseThrow().availableCpu(), "second assign must roll back");
        ClusterFixture.assertConsistent(store);
    }

    @Test
    void assignRefusesUnknownPod() {
        assertFalse(pods.assign("ghost", "A", 1, T0));
        assertEquals(4, nodes.findById("A").orElseThrow().availableCpu());
    }

    @Test
    void pendingAndByNodeQueriesKeepCreationOrder() {
        pending("p3", 1);
        pending("p1", 1);
        pending("p2", 1);
        pods.assign("p1", "A", 1, T0);

        assertEquals(List.of("p3", "p2"), pods.findPending().stream().map(Pod::id).toList());
        assertEquals(List.of("p1"), pods.findByNode("A").stream().map(Pod::id).toList());
        assertEquals(List.of("p3", "p1", "p2"), pods.findAll().stream().map(Pod::id).toList());
        assertEquals(1, pods.countByStatus(PodStatus.RUNNING));
        assertEquals(2, pods.countByStatus(PodStatus.PENDING));
    }
}
