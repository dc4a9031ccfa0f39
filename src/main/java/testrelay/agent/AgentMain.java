package testrelay.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.agent.client.CoordinatorClientException;
import testrelay.agent.client.HttpCoordinatorClient;
import testrelay.agent.tool.LoadToolRunner;
import testrelay.agent.tool.ToolLocator;
import testrelay.agent.tool.ToolNotFoundException;

import java.util.concurrent.CountDownLatch;

/**
 * Worker agent entry point.
 *
 * Exits 1 when the configuration is incomplete or registration fails.
 */
public final class AgentMain {

    private static final Logger log = LoggerFactory.getLogger(AgentMain.class);

    private AgentMain() {
    }

    public static void main(String[] args) {
        AgentConfig config;
        try {
            config = AgentConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid agent configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        log.info("Starting agent with {}", config);

        ToolLocator locator = ToolLocator.forHost(config);
        try {
            log.info("JMeter found at {}", locator.locate());
        } catch (ToolNotFoundException e) {
            log.warn("{}; jobs will fail until it is installed", e.getMessage());
        }

        AgentWorker worker = new AgentWorker(config, new HttpCoordinatorClient(config),
                new JMeterJobExecutor(config, locator, new LoadToolRunner(config.toolTimeout())));

        try {
            worker.start();
        } catch (CoordinatorClientException e) {
            log.error("Registration failed: {}", e.getMessage());
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            worker.stop();
            stopped.countDown();
        }, "agent-shutdown"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
