package podpilot.controlplane.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.exception.StoreException;
import podpilot.controlplane.model.Node;
import podpilot.controlplane.model.NodeStatus;
import podpilot.controlplane.repository.NodeRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static podpilot.controlplane.store.JdbcSupport.setTimestamp;
import static podpilot.controlplane.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of NodeRepository.
 */
public class JdbcNodeRepository implements NodeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcNodeRepository.class);

    private final Database db;
    private final AtomicLong seq = new AtomicLong();

    public JdbcNodeRepository(Database db) {
        this.db = db;
        initSequence();
    }

    private void initSequence() {
        try {
            seq.set(JdbcSupport.maxSeq(db, "nodes"));
        } catch (SQLException e) {
            throw new StoreException("Failed to read node sequence", e);
        }
    }

    @Override
    public void insert(Node node) {
        String sql = """
                    INSERT INTO nodes (id, seq, total_cpu, available_cpu, status, last_heartbeat, registered_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, node.id());
            ps.setLong(2, seq.incrementAndGet());
            ps.setInt(3, node.totalCpu());
            ps.setInt(4, node.availableCpu());
            ps.setString(5, node.status().name());
            setTimestamp(ps, 6, node.lastHeartbeat());
            setTimestamp(ps, 7, node.registeredAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert node: " + node.id(), e);
        }
    }

    @Override
    public Optional<Node> findById(String nodeId) {
        String sql = "SELECT * FROM nodes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find node: " + nodeId, e);
        }
    }

    @Override
    public boolean exists(String nodeId) {
        String sql = "SELECT 1 FROM nodes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to check node: " + nodeId, e);
        }
    }

    @Override
    public List<Node> findAll() {
        String sql = "SELECT * FROM nodes ORDER BY seq";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find all nodes", e);
        }
    }

    @Override
    public List<Node> findByStatus(NodeStatus status) {
        String sql = "SELECT * FROM nodes WHERE status = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find nodes by status: " + status, e);
        }
    }

    @Override
    public boolean markHealthy(String nodeId, Instant now) {
        String sql = "UPDATE nodes SET status = 'HEALTHY', last_heartbeat = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, nodeId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark node healthy: " + nodeId, e);
        }
    }

    @Override
    public List<String> markUnhealthy(String nodeId) {
        try {
            return db.transaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE nodes SET status = 'UNHEALTHY' WHERE id = ?")) {
                    ps.setString(1, nodeId);
                    ps.executeUpdate();
                }
                return evictPods(conn, nodeId);
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to mark node unhealthy: " + nodeId, e);
        }
    }

    @Override
    public List<String> delete(String nodeId) {
        try {
            return db.transaction(conn -> {
                List<String> evicted = evictPods(conn, nodeId);
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM nodes WHERE id = ?")) {
                    ps.setString(1, nodeId);
                    ps.executeUpdate();
                }
                return evicted;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to delete node: " + nodeId, e);
        }
    }

    /**
     * Return every pod on the node to PENDING and give its CPU back to the node.
     * Runs on the caller's connection so it joins the caller's transaction.
     */
    private List<String> evictPods(Connection conn, String nodeId) throws SQLException {
        List<String> podIds = new ArrayList<>();
        long freedCpu = 0;

        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, cpu_request FROM pods WHERE assigned_node = ? ORDER BY seq")) {
            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    podIds.add(rs.getString("id"));
                    freedCpu += rs.getInt("cpu_request");
                }
            }
        }

        if (podIds.isEmpty()) {
            return podIds;
        }

        try (PreparedStatement ps = conn.prepareStatement("""
                    UPDATE pods SET assigned_node = NULL, status = 'PENDING', scheduled_at = NULL
                    WHERE assigned_node = ?
                """)) {
            ps.setString(1, nodeId);
            ps.executeUpdate();
        }

        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE nodes SET available_cpu = available_cpu + ? WHERE id = ?")) {
            ps.setLong(1, freedCpu);
            ps.setString(2, nodeId);
            ps.executeUpdate();
        }

        log.debug("Evicted {} pods from node {} ({} cpu freed)", podIds.size(), nodeId, freedCpu);
        return podIds;
    }

    @Override
    public List<String> findStale(Instant cutoff) {
        String sql = "SELECT id FROM nodes WHERE status = 'HEALTHY' AND last_heartbeat < ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find stale nodes", e);
        }
    }

    @Override
    public int touchAll(Instant now) {
        String sql = "UPDATE nodes SET last_heartbeat = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new StoreException("Failed to refresh node heartbeats", e);
        }
    }

    @Override
    public long sumAvailableCpuSince(Instant cutoff) {
        String sql = "SELECT COALESCE(SUM(available_cpu), 0) FROM nodes WHERE last_heartbeat >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to sum available cpu", e);
        }
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM nodes";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count nodes", e);
        }
    }

    @Override
    public int countByStatus(NodeStatus status) {
        String sql = "SELECT COUNT(*) FROM nodes WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count nodes by status", e);
        }
    }

    private List<Node> mapRows(ResultSet rs) throws SQLException {
        List<Node> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Node mapRow(ResultSet rs) throws SQLException {
        return Node.builder()
                .id(rs.getString("id"))
                .totalCpu(rs.getInt("total_cpu"))
                .availableCpu(rs.getInt("available_cpu"))
                .status(NodeStatus.valueOf(rs.getString("status")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .build();
    }
}
