package taskrunner;

import taskrunner.service.config.Dependencies;
import taskrunner.service.config.ServiceConfig;
import taskrunner.service.server.TaskNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Service entry point.
 *
 * Wires dependencies from the environment, starts the HTTP server and blocks
 * until the JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig config;
        try {
            config = ServiceConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        Dependencies deps = Dependencies.create(config);
        deps.startScheduler();

        if (!TaskNettyServer.start(deps)) {
            log.error("Server did not start, exiting");
            deps.close();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            TaskNettyServer.stop();
            deps.close();
            stopped.countDown();
        }, "shutdown"));

        stopped.await();
    }
}
