package podpilot.controlplane.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.exception.StoreException;
import podpilot.controlplane.model.Pod;
import podpilot.controlplane.model.PodStatus;
import podpilot.controlplane.repository.PodRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static podpilot.controlplane.store.JdbcSupport.setTimestamp;
import static podpilot.controlplane.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of PodRepository.
 * Placement writes the node deduction and the pod assignment in one transaction.
 */
public class JdbcPodRepository implements PodRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPodRepository.class);

    private final Database db;
    private final AtomicLong seq = new AtomicLong();

    public JdbcPodRepository(Database db) {
        this.db = db;
        try {
            seq.set(JdbcSupport.maxSeq(db, "pods"));
        } catch (SQLException e) {
            throw new StoreException("Failed to read pod sequence", e);
        }
    }

    @Override
    public void insert(Pod pod) {
        String sql = """
                    INSERT INTO pods (id, seq, cpu_request, assigned_node, status, created_at, scheduled_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, pod.id());
            ps.setLong(2, seq.incrementAndGet());
            ps.setInt(3, pod.cpuRequest());
            ps.setString(4, pod.assignedNode());
            ps.setString(5, pod.status().name());
            setTimestamp(ps, 6, pod.createdAt());
            setTimestamp(ps, 7, pod.scheduledAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert pod: " + pod.id(), e);
        }
    }

    @Override
    public Optional<Pod> findById(String podId) {
        String sql = "SELECT * FROM pods WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, podId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find pod: " + podId, e);
        }
    }

    @Override
    public boolean exists(String podId) {
        String sql = "SELECT 1 FROM pods WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, podId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to check pod: " + podId, e);
        }
    }

    @Override
    public List<Pod> findAll() {
        String sql = "SELECT * FROM pods ORDER BY seq";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find all pods", e);
        }
    }

    @Override
    public List<Pod> findPending() {
        String sql = "SELECT * FROM pods WHERE assigned_node IS NULL ORDER BY seq";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending pods", e);
        }
    }

    @Override
    public List<Pod> findByNode(String nodeId) {
        String sql = "SELECT * FROM pods WHERE assigned_node = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find pods for node: " + nodeId, e);
        }
    }

    @Override
    public boolean assign(String podId, String nodeId, int cpuRequest, Instant now) {
        String deductSql = """
                    UPDATE nodes SET available_cpu = available_cpu - ?
                    WHERE id = ? AND status = 'HEALTHY' AND available_cpu >= ?
                """;

        String assignSql = """
                    UPDATE pods SET assigned_node = ?, status = 'RUNNING', scheduled_at = ?
                    WHERE id = ? AND assigned_node IS NULL
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement deduct = conn.prepareStatement(deductSql);
                    PreparedStatement assign = conn.prepareStatement(assignSql)) {

                deduct.setInt(1, cpuRequest);
                deduct.setString(2, nodeId);
                deduct.setInt(3, cpuRequest);
                if (deduct.executeUpdate() == 0) {
                    conn.rollback();
                    log.debug("Node {} cannot take {} cpu for pod {}", nodeId, cpuRequest, podId);
                    return false;
                }

                assign.setString(1, nodeId);
                setTimestamp(assign, 2, now);
                assign.setString(3, podId);
                if (assign.executeUpdate() == 0) {
                    conn.rollback();
                    log.debug("Pod {} is missing or already assigned", podId);
                    return false;
                }

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to assign pod " + podId + " to node " + nodeId, e);
        }
    }

    @Override
    public int countByStatus(PodStatus status) {
        String sql = "SELECT COUNT(*) FROM pods WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count pods by status", e);
        }
    }

    private List<Pod> mapRows(ResultSet rs) throws SQLException {
        List<Pod> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Pod mapRow(ResultSet rs) throws SQLException {
        return Pod.builder()
                .id(rs.getString("id"))
                .cpuRequest(rs.getInt("cpu_request"))
                .assignedNode(rs.getString("assigned_node"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
                .build();
    }
}
