package podpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podpilot.controlplane.config.ControlPlaneConfig;
import podpilot.controlplane.config.Dependencies;

import java.util.concurrent.CountDownLatch;

/**
 * Control plane entry point: HTTP API plus background control loop.
 */
public final class PodPilotApp {

    private static final Logger log = LoggerFactory.getLogger(PodPilotApp.class);

    private PodPilotApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        ControlPlaneConfig config = ControlPlaneConfig.load();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down control plane");
            deps.close();
            shutdown.countDown();
        }, "podpilot-shutdown"));

        try {
            deps.server().start();
            deps.startControlLoop();
        } catch (RuntimeException e) {
            log.error("Control plane failed to start", e);
            deps.close();
            System.exit(1);
        }

        log.info("Control plane running on port {}", deps.server().port());
        shutdown.await();
    }
}
