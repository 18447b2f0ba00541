package podpilot.controlplane.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.config.ControlPlaneConfig;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * Unit of work executed on a single connection inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(ControlPlaneConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), config.resetOnStartup());
    }

    public Database(String jdbcUrl, int poolSize, boolean resetOnStartup) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("podpilot-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        if (resetOnStartup) {
            dropSchema();
        }
        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Run work on one connection and commit; roll back if it throws.
     */
    public <T> T transaction(SqlWork<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void dropSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {
            st.addBatch("DROP TABLE IF EXISTS pods");
            st.addBatch("DROP TABLE IF EXISTS nodes");
            st.addBatch("DROP TABLE IF EXISTS settings");
            st.executeBatch();
            conn.commit();
            log.info("Dropped existing cluster tables (clean-slate boot)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to drop database schema", e);
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id              VARCHAR(128) PRIMARY KEY,
                            seq             BIGINT NOT NULL,
                            total_cpu       INT NOT NULL,
                            available_cpu   INT NOT NULL,
                            status          VARCHAR(20) DEFAULT 'HEALTHY',
                            last_heartbeat  TIMESTAMP NOT NULL,
                            registered_at   TIMESTAMP,
                            CHECK (available_cpu >= 0 AND available_cpu <= total_cpu)
                        );
                    """);

            // ---------- PODS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pods (
                            id              VARCHAR(128) PRIMARY KEY,
                            seq             BIGINT NOT NULL,
                            cpu_request     INT NOT NULL,
                            assigned_node   VARCHAR(128),
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            created_at      TIMESTAMP,
                            scheduled_at    TIMESTAMP,
                            FOREIGN KEY (assigned_node) REFERENCES nodes (id)
                        );
                    """);

            // ---------- SETTINGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS settings (
                            setting_key     VARCHAR(64) PRIMARY KEY,
                            setting_value   VARCHAR(256)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_seq ON nodes(seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_nodes_heartbeat ON nodes(last_heartbeat);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_pods_seq ON pods(seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_pods_assigned ON pods(assigned_node);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
