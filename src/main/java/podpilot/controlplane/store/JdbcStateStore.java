package podpilot.controlplane.store;

import podpilot.controlplane.repository.NodeRepository;
import podpilot.controlplane.repository.PodRepository;
import podpilot.controlplane.repository.SettingsRepository;
import podpilot.controlplane.repository.StateStore;

/**
 * StateStore backed by the JDBC repositories over one {@link Database}.
 */
public final class JdbcStateStore implements StateStore {

    private final Database database;
    private final NodeRepository nodes;
    private final PodRepository pods;
    private final SettingsRepository settings;

    public JdbcStateStore(Database database) {
        this.database = database;
        this.nodes = new JdbcNodeRepository(database);
        this.pods = new JdbcPodRepository(database);
        this.settings = new JdbcSettingsRepository(database);
    }

    @Override
    public NodeRepository nodes() {
        return nodes;
    }

    @Override
    public PodRepository pods() {
        return pods;
    }

    @Override
    public SettingsRepository settings() {
        return settings;
    }

    @Override
    public boolean isHealthy() {
        return database.isHealthy();
    }
}
