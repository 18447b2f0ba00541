package podpilot.controlplane.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.api.internal.v1.HeartbeatController;
import podpilot.controlplane.api.v1.ClusterController;
import podpilot.controlplane.api.v1.HealthController;
import podpilot.controlplane.api.v1.NodeController;
import podpilot.controlplane.api.v1.PodController;
import podpilot.controlplane.control.ControlLoop;
import podpilot.controlplane.control.FailureDetector;
import podpilot.controlplane.control.HeartbeatSimulator;
import podpilot.controlplane.control.Rescheduler;
import podpilot.controlplane.core.ClusterLock;
import podpilot.controlplane.placement.PodScheduler;
import podpilot.controlplane.repository.StateStore;
import podpilot.controlplane.server.ControlPlaneServer;
import podpilot.controlplane.server.RouterHandler;
import podpilot.controlplane.service.ClusterSettings;
import podpilot.controlplane.service.LeaderElector;
import podpilot.controlplane.service.MetricsAggregator;
import podpilot.controlplane.service.NodeRegistry;
import podpilot.controlplane.service.PodRegistry;
import podpilot.controlplane.store.Database;
import podpilot.controlplane.store.JdbcStateStore;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all control plane components around one store, one
 * cluster lock and one clock.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ControlPlaneConfig.load());
 * deps.server().start();
 * deps.startControlLoop();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ControlPlaneConfig config;
    private final Clock clock;
    private final Database database;
    private final StateStore store;
    private final ClusterLock lock;

    private final ClusterSettings clusterSettings;
    private final PodScheduler podScheduler;
    private final NodeRegistry nodeRegistry;
    private final PodRegistry podRegistry;
    private final LeaderElector leaderElector;
    private final MetricsAggregator metricsAggregator;

    private final FailureDetector failureDetector;
    private final Rescheduler rescheduler;
    private final HeartbeatSimulator heartbeatSimulator;

    // Controllers
    private final NodeController nodeController;
    private final PodController podController;
    private final ClusterController clusterController;
    private final HealthController healthController;
    private final HeartbeatController heartbeatController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private ControlLoop controlLoop;
    private ControlPlaneServer server;

    private Dependencies(ControlPlaneConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.store = new JdbcStateStore(database);
        this.lock = new ClusterLock();

        // Services
        this.clusterSettings = new ClusterSettings(store, lock, config.defaultStrategy());
        this.podScheduler = new PodScheduler(store, lock, clock);
        this.nodeRegistry = new NodeRegistry(store, lock, clock, config.defaultNodeCpu(),
                config.maxScaleUp());
        this.podRegistry = new PodRegistry(store, podScheduler, clusterSettings, lock, clock,
                config.heartbeatTimeout());
        this.leaderElector = new LeaderElector(store, clusterSettings, lock);
        this.metricsAggregator = new MetricsAggregator(store, clusterSettings, lock);

        // Background tasks
        this.failureDetector = new FailureDetector(store, lock, clock, config.heartbeatTimeout());
        this.rescheduler = new Rescheduler(store, podScheduler, clusterSettings, lock);
        this.heartbeatSimulator = new HeartbeatSimulator(store, lock, clock);

        // Controllers
        this.nodeController = new NodeController(nodeRegistry);
        this.podController = new PodController(podRegistry);
        this.clusterController = new ClusterController(leaderElector, clusterSettings, metricsAggregator);
        this.healthController = new HealthController(store, metricsAggregator);
        this.heartbeatController = new HeartbeatController(nodeRegistry);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(ControlPlaneConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Create dependencies driven by the given clock (tests pass a controllable one).
     */
    public static Dependencies create(ControlPlaneConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies from the config file and environment.
     */
    public static Dependencies create() {
        return create(ControlPlaneConfig.load());
    }

    public ControlPlaneConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public StateStore store() {
        return store;
    }

    public ClusterLock lock() {
        return lock;
    }

    public ClusterSettings clusterSettings() {
        return clusterSettings;
    }

    public PodScheduler podScheduler() {
        return podScheduler;
    }

    public NodeRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public PodRegistry podRegistry() {
        return podRegistry;
    }

    public LeaderElector leaderElector() {
        return leaderElector;
    }

    public MetricsAggregator metricsAggregator() {
        return metricsAggregator;
    }

    public FailureDetector failureDetector() {
        return failureDetector;
    }

    public Rescheduler rescheduler() {
        return rescheduler;
    }

    public HeartbeatSimulator heartbeatSimulator() {
        return heartbeatSimulator;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(nodeController)
                    .registerController(podController)
                    .registerController(clusterController)
                    .registerController(heartbeatController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized ControlPlaneServer server() {
        if (server == null) {
            server = new ControlPlaneServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        return server;
    }

    public synchronized ControlLoop controlLoop() {
        if (controlLoop == null) {
            controlLoop = new ControlLoop(failureDetector, rescheduler, heartbeatSimulator, config);
        }
        return controlLoop;
    }

    /**
     * Start failure detection, rescheduling and (if enabled) simulated heartbeats.
     */
    public void startControlLoop() {
        controlLoop().start();
    }

    public synchronized void stopControlLoop() {
        if (controlLoop != null) {
            controlLoop.stop();
        }
    }

    @Override
    public synchronized void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        if (controlLoop != null) {
            try {
                controlLoop.stop();
            } catch (Exception e) {
                log.warn("Error stopping control loop: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
