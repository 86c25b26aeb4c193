package agentswarm.coordinator;

import agentswarm.coordinator.config.CoordinatorConfig;
import agentswarm.coordinator.config.Dependencies;
import agentswarm.coordinator.server.CoordinatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Control-plane entry point: HTTP API plus the reaper.
 */
public final class CoordinatorMain {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorMain.class);

    private CoordinatorMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorServer server = new CoordinatorServer(deps.routerHandler(),
                Math.max(4, Runtime.getRuntime().availableProcessors()));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down coordinator");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "coordinator-shutdown"));

        server.start(config.serverHost(), config.serverPort());
        deps.startReaper();
        stopped.await();
    }
}
