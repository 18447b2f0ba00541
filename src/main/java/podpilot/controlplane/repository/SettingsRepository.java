package podpilot.controlplane.repository;

import java.util.Optional;

/**
 * Repository interface for the cluster-wide settings map.
 */
public interface SettingsRepository {

    String STRATEGY = "strategy";
    String LEADER = "leader";

    /**
     * Read a setting.
     */
    Optional<String> get(String key);

    /**
     * Create or replace a setting.
     */
    void put(String key, String value);
}
