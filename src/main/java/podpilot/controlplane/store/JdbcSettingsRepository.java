package podpilot.controlplane.store;

import podpilot.controlplane.exception.StoreException;
import podpilot.controlplane.repository.SettingsRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of SettingsRepository.
 */
public class JdbcSettingsRepository implements SettingsRepository {

    private final Database db;

    public JdbcSettingsRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT setting_value FROM settings WHERE setting_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read setting: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        // UPDATE, then INSERT if no row matched
        String updateSql = "UPDATE settings SET setting_value = ? WHERE setting_key = ?";
        String insertSql = "INSERT INTO settings (setting_key, setting_value) VALUES (?, ?)";

        try {
            db.transaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, value);
                    ps.setString(2, key);
                    if (ps.executeUpdate() > 0) {
                        return null;
                    }
                }
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, key);
                    ps.setString(2, value);
                    ps.executeUpdate();
                }
                return null;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to write setting: " + key, e);
        }
    }
}
