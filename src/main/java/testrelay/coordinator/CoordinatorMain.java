package testrelay.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
import testrelay.coordinator.server.CoordinatorServer;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point: HTTP server plus background scheduler.
 *
 * Exits 1 when the database or the listening socket cannot be set up.
 */
public final class CoordinatorMain {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorMain.class);

    private CoordinatorMain() {
    }

    public static void main(String[] args) {
        CountDownLatch stopped = new CountDownLatch(1);

        try {
            CoordinatorConfig config = CoordinatorConfig.fromEnv();
            Dependencies deps = Dependencies.create(config);
            CoordinatorServer server = new CoordinatorServer(deps.routerHandler(), config.serverHost(),
                    config.serverPort());

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down coordinator");
                server.stop();
                deps.close();
                stopped.countDown();
            }, "testrelay-shutdown"));

            int port = server.start();
            deps.startScheduler();
            log.info("Coordinator ready on port {}", port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted during startup");
            System.exit(1);
        } catch (Exception e) {
            log.error("Failed to start coordinator", e);
            System.exit(1);
        }

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
