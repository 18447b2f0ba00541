package podpilot.controlplane.repository;

/**
 * Durable cluster state: node table, pod table and settings map.
 * Callers serialize access through {@code ClusterLock}.
 */
public interface StateStore {

    NodeRepository nodes();

    PodRepository pods();

    SettingsRepository settings();

    /**
     * Check if the underlying store is reachable.
     */
    boolean isHealthy();
}
