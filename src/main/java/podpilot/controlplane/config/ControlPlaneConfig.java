package podpilot.controlplane.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.placement.PlacementStrategy;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for control plane settings.
 * All settings have sensible defaults.
 *
 * Sources, lowest precedence first: defaults, an optional INI file
 * ({@code PODPILOT_CONFIG}), environment variables.
 */
public final class ControlPlaneConfig {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneConfig.class);

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/podpilot;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private boolean resetOnStartup = true;

    // Server settings
    private int serverPort = 5000;
    private String serverHost = "0.0.0.0";

    // Failure detection and background loops
    private Duration heartbeatTimeout = Duration.ofSeconds(30);
    private Duration failureDetectorInterval = Duration.ofSeconds(10);
    private Duration reschedulerInterval = Duration.ofSeconds(15);
    private Duration heartbeatRefreshInterval = Duration.ofSeconds(5);
    private boolean heartbeatSimulatorEnabled = true;

    // Cluster settings
    private int defaultNodeCpu = 4;
    private int maxScaleUp = 100;
    private PlacementStrategy defaultStrategy = PlacementStrategy.DEFAULT;

    // Auth settings (optional)
    private String agentKey = null; // If set, nodes must provide X-PodPilot-Key on /internal endpoints

    private ControlPlaneConfig() {
    }

    public static ControlPlaneConfig defaults() {
        return new ControlPlaneConfig();
    }

    /**
     * Full configuration: defaults, then the INI file named by PODPILOT_CONFIG
     * (if any), then environment overrides.
     */
    public static ControlPlaneConfig load() {
        ControlPlaneConfig config = new ControlPlaneConfig();
        String path = System.getenv("PODPILOT_CONFIG");
        if (path != null && !path.isBlank()) {
            config.applyIni(new File(path));
        }
        config.applyEnv(System.getenv());
        return config;
    }

    public static ControlPlaneConfig fromEnv() {
        ControlPlaneConfig config = new ControlPlaneConfig();
        config.applyEnv(System.getenv());
        return config;
    }

    /**
     * Load settings from an INI file on top of the defaults.
     * Recognized sections: [server], [database], [cluster].
     */
    public static ControlPlaneConfig fromIni(File file) {
        ControlPlaneConfig config = new ControlPlaneConfig();
        config.applyIni(file);
        return config;
    }

    ControlPlaneConfig applyIni(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }

        Profile.Section server = ini.get("server");
        Profile.Section database = ini.get("database");
        Profile.Section cluster = ini.get("cluster");

        String v;
        if ((v = opt(server, "host")) != null) serverHost = v;
        if ((v = opt(server, "port")) != null) serverPort = Integer.parseInt(v);
        if ((v = opt(server, "agent_key")) != null) agentKey = v;

        if ((v = opt(database, "url")) != null) databaseUrl = v;
        if ((v = opt(database, "pool_size")) != null) databasePoolSize = Integer.parseInt(v);
        if ((v = opt(database, "reset_on_startup")) != null) resetOnStartup = Boolean.parseBoolean(v);

        if ((v = opt(cluster, "heartbeat_timeout_seconds")) != null) heartbeatTimeout = seconds(v);
        if ((v = opt(cluster, "failure_detector_interval_seconds")) != null) failureDetectorInterval = seconds(v);
        if ((v = opt(cluster, "rescheduler_interval_seconds")) != null) reschedulerInterval = seconds(v);
        if ((v = opt(cluster, "heartbeat_refresh_interval_seconds")) != null) heartbeatRefreshInterval = seconds(v);
        if ((v = opt(cluster, "heartbeat_simulator")) != null) heartbeatSimulatorEnabled = Boolean.parseBoolean(v);
        if ((v = opt(cluster, "default_node_cpu")) != null) defaultNodeCpu = Integer.parseInt(v);
        if ((v = opt(cluster, "max_scale_up")) != null) maxScaleUp = Integer.parseInt(v);
        if ((v = opt(cluster, "strategy")) != null) defaultStrategy = PlacementStrategy.fromName(v);

        log.info("Loaded configuration file {}", file);
        return this;
    }

    ControlPlaneConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("PODPILOT_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("PODPILOT_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String key = env.get("PODPILOT_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String reset = env.get("PODPILOT_RESET_ON_STARTUP");
        if (reset != null && !reset.isBlank()) {
            resetOnStartup = Boolean.parseBoolean(reset);
        }

        String simulator = env.get("PODPILOT_HEARTBEAT_SIMULATOR");
        if (simulator != null && !simulator.isBlank()) {
            heartbeatSimulatorEnabled = Boolean.parseBoolean(simulator);
        }

        String strategy = env.get("PODPILOT_STRATEGY");
        if (strategy != null && !strategy.isBlank()) {
            defaultStrategy = PlacementStrategy.fromName(strategy);
        }

        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public boolean resetOnStartup() {
        return resetOnStartup;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration failureDetectorInterval() {
        return failureDetectorInterval;
    }

    public Duration reschedulerInterval() {
        return reschedulerInterval;
    }

    public Duration heartbeatRefreshInterval() {
        return heartbeatRefreshInterval;
    }

    public boolean heartbeatSimulatorEnabled() {
        return heartbeatSimulatorEnabled;
    }

    public int defaultNodeCpu() {
        return defaultNodeCpu;
    }

    /** Upper bound on nodes added by one scale-up request */
    public int maxScaleUp() {
        return maxScaleUp;
    }

    public PlacementStrategy defaultStrategy() {
        return defaultStrategy;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public ControlPlaneConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ControlPlaneConfig withResetOnStartup(boolean reset) {
        this.resetOnStartup = reset;
        return this;
    }

    public ControlPlaneConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ControlPlaneConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ControlPlaneConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public ControlPlaneConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public ControlPlaneConfig withFailureDetectorInterval(Duration interval) {
        this.failureDetectorInterval = interval;
        return this;
    }

    public ControlPlaneConfig withReschedulerInterval(Duration interval) {
        this.reschedulerInterval = interval;
        return this;
    }

    public ControlPlaneConfig withHeartbeatRefreshInterval(Duration interval) {
        this.heartbeatRefreshInterval = interval;
        return this;
    }

    public ControlPlaneConfig withHeartbeatSimulator(boolean enabled) {
        this.heartbeatSimulatorEnabled = enabled;
        return this;
    }

    public ControlPlaneConfig withDefaultNodeCpu(int cpu) {
        this.defaultNodeCpu = cpu;
        return this;
    }

    public ControlPlaneConfig withMaxScaleUp(int max) {
        this.maxScaleUp = max;
        return this;
    }

    public ControlPlaneConfig withDefaultStrategy(PlacementStrategy strategy) {
        this.defaultStrategy = strategy;
        return this;
    }

    private static String opt(Profile.Section section, String key) {
        if (section == null) {
            return null;
        }
        String value = section.get(key);
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static Duration seconds(String value) {
        return Duration.ofSeconds(Long.parseLong(value));
    }

    @Override
    public String toString() {
        return "ControlPlaneConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", heartbeatTimeout=" + heartbeatTimeout +
                ", heartbeatSimulator=" + heartbeatSimulatorEnabled +
                ", defaultStrategy=" + defaultStrategy +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
