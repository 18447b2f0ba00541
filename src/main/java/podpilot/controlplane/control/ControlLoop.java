package podpilot.controlplane.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.config.ControlPlaneConfig;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates the periodic background tasks:
 * - FailureDetector: fails silent nodes and evicts their pods
 * - Rescheduler: places pending pods
 * - HeartbeatSimulator: refreshes node heartbeats (optional)
 *
 * Uses a single-threaded executor; the tasks also serialize on the cluster lock.
 */
public class ControlLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    private final ScheduledExecutorService executor;
    private final FailureDetector failureDetector;
    private final Rescheduler rescheduler;
    private final HeartbeatSimulator heartbeatSimulator;
    private final ControlPlaneConfig config;

    private volatile boolean running = false;

    public ControlLoop(FailureDetector failureDetector,
            Rescheduler rescheduler,
            HeartbeatSimulator heartbeatSimulator,
            ControlPlaneConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "podpilot-control-loop");
            t.setDaemon(true);
            return t;
        });
        this.failureDetector = failureDetector;
        this.rescheduler = rescheduler;
        this.heartbeatSimulator = heartbeatSimulator;
        this.config = config;
    }

    /**
     * Start the periodic tasks.
     */
    public void start() {
        if (running) {
            log.warn("Control loop already running");
            return;
        }

        running = true;

        schedule("failure-detector", failureDetector, config.failureDetectorInterval());
        schedule("rescheduler", rescheduler, config.reschedulerInterval());

        if (config.heartbeatSimulatorEnabled()) {
            schedule("heartbeat-simulator", heartbeatSimulator, config.heartbeatRefreshInterval());
        } else {
            log.info("Heartbeat simulator disabled");
        }

        log.info("Control loop started");
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable(name, task),
                intervalMs, // initial delay
                intervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    /**
     * Stop the periodic tasks gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Control loop forcefully stopped");
            } else {
                log.info("Control loop stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
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
     * Keep an escaping exception from cancelling the periodic schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
