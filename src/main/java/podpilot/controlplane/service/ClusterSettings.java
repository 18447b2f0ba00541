package podpilot.controlplane.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.placement.PlacementStrategy;
import podpilot.controlplane.repository.SettingsRepository;
import podpilot.controlplane.repository.StateStore;

import java.util.Optional;

/**
 * Cluster-wide settings: the placement strategy and the recorded leader.
 */
public class ClusterSettings {

    private static final Logger log = LoggerFactory.getLogger(ClusterSettings.class);

    private final SettingsRepository settings;
    private final ClusterLock lock;
    private final PlacementStrategy fallbackStrategy;

    public ClusterSettings(StateStore store, ClusterLock lock, PlacementStrategy fallbackStrategy) {
        this.settings = store.settings();
        this.lock = lock;
        this.fallbackStrategy = fallbackStrategy;
    }

    /**
     * Current placement strategy; the configured default until one is set.
     */
    public PlacementStrategy strategy() {
        return lock.call(() -> settings.get(SettingsRepository.STRATEGY)
                .map(PlacementStrategy::fromName)
                .orElse(fallbackStrategy));
    }

    /**
     * Store a strategy by name. Unrecognized names store best_fit.
     *
     * @return the strategy actually stored
     */
    public PlacementStrategy setStrategy(String name) {
        PlacementStrategy strategy = PlacementStrategy.fromName(name);
        if (PlacementStrategy.parse(name).isEmpty()) {
            log.warn("Unknown strategy '{}', using {}", name, strategy);
        }
        lock.run(() -> settings.put(SettingsRepository.STRATEGY, strategy.wireName()));
        log.info("Placement strategy set to {}", strategy);
        return strategy;
    }

    public Optional<String> leader() {
        return lock.call(() -> settings.get(SettingsRepository.LEADER));
    }

    public void setLeader(String leader) {
        lock.run(() -> settings.put(SettingsRepository.LEADER, leader));
    }
}
