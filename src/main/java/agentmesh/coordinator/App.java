package agentmesh.coordinator;

import agentmesh.coordinator.config.CoordinatorConfig;
import agentmesh.coordinator.config.Dependencies;
import agentmesh.coordinator.server.CoordinatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Loads configuration (defaults, then {@code AGENTMESH_CONFIG}, then the
 * environment), wires the components, and serves the HTTP API until the
 * process is stopped.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.load();
        Dependencies deps = Dependencies.create(config);
        CoordinatorServer server = new CoordinatorServer(deps.routerHandler());

        log.info("Starting coordinator on port {}...", config.serverPort());
        if (!server.start(config.serverHost(), config.serverPort())) {
            log.error("Coordinator server did not start, exiting");
            deps.close();
            System.exit(1);
        }
        deps.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "agentmesh-shutdown"));

        stopped.await();
    }
}
