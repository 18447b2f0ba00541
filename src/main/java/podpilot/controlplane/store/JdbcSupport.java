package podpilot.controlplane.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Small JDBC helpers shared by the repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    /** Highest sequence number in a table, 0 when empty */
    static long maxSeq(Database db, String table) throws SQLException {
        String sql = "SELECT COALESCE(MAX(seq), 0) FROM " + table;
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
