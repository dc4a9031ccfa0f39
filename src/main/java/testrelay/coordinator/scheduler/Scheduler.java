package testrelay.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.dispatch.Dispatcher;
import testrelay.coordinator.service.RetentionCleaner;
import testrelay.coordinator.service.WorkerService;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - dispatch tick: fires due triggers
 * - worker reaper: marks silent workers OFFLINE and releases their jobs
 * - retention: deletes old execution history
 *
 * Uses a single-threaded executor so a slow dispatch pass delays, rather
 * than overlaps, the next one in this process.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Dispatcher dispatcher;
    private final WorkerService workerService;
    private final RetentionCleaner retentionCleaner;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(Dispatcher dispatcher, WorkerService workerService, RetentionCleaner retentionCleaner,
            CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "testrelay-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.dispatcher = dispatcher;
        this.workerService = workerService;
        this.retentionCleaner = retentionCleaner;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        schedule("dispatch-tick", dispatcher::tick, config.dispatchInterval());
        schedule("worker-reaper", workerService::reapStaleWorkers, config.workerReaperInterval());
        schedule("retention", retentionCleaner, config.retentionInterval());

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
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
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
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

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable(name, task), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    /**
     * Wrap a runnable with error handling.
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
