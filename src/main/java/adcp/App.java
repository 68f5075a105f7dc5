package adcp;

import adcp.workflow.config.Dependencies;
import adcp.workflow.config.WorkflowConfig;
import adcp.workflow.server.WorkflowHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: wires dependencies, serves the task API and runs background work
 * until the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        WorkflowConfig config = WorkflowConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        WorkflowHttpServer server = new WorkflowHttpServer(deps.routerHandler());
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "adcp-shutdown"));

        try {
            int port = server.start(config.serverHost(), config.serverPort());
            deps.startBackground();
            log.info("Workflow engine started on port {}", port);
        } catch (RuntimeException e) {
            log.error("Failed to start workflow engine", e);
            server.stop();
            deps.close();
            System.exit(1);
        }

        shutdown.await();
    }
}
