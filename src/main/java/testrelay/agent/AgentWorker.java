package testrelay.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.agent.client.AgentHeartbeat;
import testrelay.agent.client.AgentRegistration;
import testrelay.agent.client.AssignedJob;
import testrelay.agent.client.CoordinatorClient;
import testrelay.agent.client.CoordinatorClientException;
import testrelay.agent.client.HeartbeatAck;
import testrelay.agent.client.ReportAck;
import testrelay.agent.client.ResultReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The agent loop: register, heartbeat, poll, claim, execute, report.
 *
 * Heartbeat and poll run on independent timers. Executions run on a fixed
 * pool sized to the effective capacity, so a poll never takes more work than
 * there are free slots.
 */
public class AgentWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    public static final String HEARTBEAT_INTERVAL_SETTING = "agent_heartbeat_interval_seconds";
    public static final String POLL_INTERVAL_SETTING = "agent_poll_interval_seconds";
    public static final int DEFAULT_HEARTBEAT_SECONDS = 60;
    public static final int DEFAULT_POLL_SECONDS = 10;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final AgentConfig config;
    private final CoordinatorClient client;
    private final JobExecutor executor;
    private final int effectiveCapacity;

    private final ScheduledExecutorService timers;
    private final ExecutorService executionPool;

    private final AtomicInteger runningJobs = new AtomicInteger();
    private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.IDLE);

    private volatile Duration heartbeatInterval = Duration.ofSeconds(DEFAULT_HEARTBEAT_SECONDS);
    private volatile Duration pollInterval = Duration.ofSeconds(DEFAULT_POLL_SECONDS);

    public AgentWorker(AgentConfig config, CoordinatorClient client, JobExecutor executor) {
        this.config = config;
        this.client = client;
        this.executor = executor;
        this.effectiveCapacity = Math.max(1, Math.min(config.capacity(), executor.maxConcurrency()));

        this.timers = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "agent-timer");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger threadIndex = new AtomicInteger();
        this.executionPool = Executors.newFixedThreadPool(effectiveCapacity, r -> {
            Thread t = new Thread(r, "agent-exec-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register with the coordinator and start the heartbeat and poll timers.
     *
     * @throws CoordinatorClientException when registration fails
     */
    public void start() throws CoordinatorClientException {
        if (state.get() == AgentState.STOPPED) {
            throw new IllegalStateException("Agent already stopped");
        }

        client.register(new AgentRegistration(
                config.agentId(),
                config.agentName(),
                config.projectId(),
                effectiveCapacity,
                new ArrayList<>(config.capabilities()),
                systemInfo()));
        log.info("Registered agent {} (capacity {}, effective {})",
                config.agentId(), config.capacity(), effectiveCapacity);

        heartbeatInterval = Duration.ofSeconds(readIntervalSetting(HEARTBEAT_INTERVAL_SETTING, DEFAULT_HEARTBEAT_SECONDS));
        pollInterval = Duration.ofSeconds(readIntervalSetting(POLL_INTERVAL_SETTING, DEFAULT_POLL_SECONDS));

        timers.scheduleAtFixedRate(wrapRunnable("heartbeat", this::heartbeatOnce),
                0, heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
        timers.scheduleWithFixedDelay(wrapRunnable("poll", this::pollOnce),
                0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Heartbeat every {}s, poll every {}s", heartbeatInterval.toSeconds(), pollInterval.toSeconds());
    }

    /**
     * Stop polling, wait for in-flight jobs and send a last heartbeat.
     */
    public void stop() {
        if (state.getAndSet(AgentState.STOPPED) == AgentState.STOPPED) {
            return;
        }
        log.info("Stopping agent {}", config.agentId());

        timers.shutdownNow();
        executionPool.shutdownNow();
        try {
            if (!executionPool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Executions still running after {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            client.heartbeat(heartbeat());
        } catch (CoordinatorClientException e) {
            log.warn("Final heartbeat failed: {}", e.getMessage());
        }
        log.info("Agent {} stopped", config.agentId());
    }

    @Override
    public void close() {
        stop();
    }

    public AgentState state() {
        return state.get();
    }

    public int runningJobs() {
        return runningJobs.get();
    }

    public int effectiveCapacity() {
        return effectiveCapacity;
    }

    Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Send one heartbeat. Failures are logged and left for the next beat.
     */
    void heartbeatOnce() {
        try {
            HeartbeatAck ack = client.heartbeat(heartbeat());
            log.debug("Heartbeat ok, {} pending jobs", ack.pendingJobs());
        } catch (CoordinatorClientException e) {
            log.warn("Heartbeat failed: {}", e.getMessage());
        }
    }

    /**
     * Take at most one job if a slot is free.
     *
     * @return true if a job was handed to the execution pool
     */
    boolean pollOnce() {
        if (state.get() == AgentState.STOPPED || runningJobs.get() >= effectiveCapacity) {
            return false;
        }

        transition(AgentState.POLLING);
        try {
            Optional<AssignedJob> polled = client.poll(config.agentId());
            if (polled.isEmpty()) {
                return false;
            }
            AssignedJob job = polled.get();

            if (!client.claim(job.id(), config.agentId())) {
                log.debug("Lost claim race for job {}", job.id());
                return false;
            }
            if (!client.start(job.id(), config.agentId())) {
                log.info("Job {} was taken back before it started", job.id());
                return false;
            }

            runningJobs.incrementAndGet();
            try {
                executionPool.execute(() -> runJob(job));
            } catch (RejectedExecutionException e) {
                runningJobs.decrementAndGet();
                log.warn("Agent stopping, job {} left for the coordinator to release", job.id());
                return false;
            }
            log.info("Started job {} (run {})", job.id(), job.runId());
            return true;

        } catch (CoordinatorClientException e) {
            log.warn("Poll failed: {}", e.getMessage());
            return false;
        } finally {
            settleState();
        }
    }

    /**
     * Execute one started job and report its outcome exactly once.
     */
    void runJob(AssignedJob job) {
        settleState();
        try {
            ExecutionResult result;
            try {
                result = executor.execute(job);
            } catch (RuntimeException e) {
                log.error("Executor crashed on job {}", job.id(), e);
                result = ExecutionResult.failure("Executor error: " + e.getMessage());
            }
            report(job, result);
        } finally {
            runningJobs.decrementAndGet();
            settleState();
        }
    }

    private void report(AssignedJob job, ExecutionResult result) {
        try {
            // Cancelled or released while we were running
            Optional<AssignedJob> current = client.getJob(job.id());
            if (current.isEmpty() || !current.get().isRunningFor(config.agentId())) {
                log.info("Job {} is no longer running on this agent, not reporting", job.id());
                return;
            }

            ResultReport report = result.success()
                    ? ResultReport.completed(config.agentId(), result.summary(), result.resultLogBase64(),
                            result.reportBase64())
                    : ResultReport.failed(config.agentId(), result.summary(), result.errorMessage());

            ReportAck ack = client.report(job.id(), report);
            log.info("Job {} reported {} (outcome {}, retry {})",
                    job.id(), report.status(), ack.outcome(), ack.willRetry());
        } catch (CoordinatorClientException e) {
            log.error("Failed to report result for job {}: {}", job.id(), e.getMessage());
        }
    }

    private AgentHeartbeat heartbeat() {
        int running = runningJobs.get();
        return new AgentHeartbeat(
                config.agentId(),
                Math.max(0, effectiveCapacity - running),
                effectiveCapacity,
                running,
                systemInfo());
    }

    private int readIntervalSetting(String key, int defaultSeconds) {
        try {
            Optional<String> value = client.fetchSetting(key);
            if (value.isPresent()) {
                int seconds = Integer.parseInt(value.get().trim());
                if (seconds > 0) {
                    return seconds;
                }
                log.warn("Ignoring non-positive {}={}", key, seconds);
            }
        } catch (CoordinatorClientException | NumberFormatException e) {
            log.warn("Could not read setting {}, using {}s: {}", key, defaultSeconds, e.getMessage());
        }
        return defaultSeconds;
    }

    private void transition(AgentState next) {
        state.updateAndGet(current -> current == AgentState.STOPPED ? current : next);
    }

    private void settleState() {
        transition(runningJobs.get() > 0 ? AgentState.EXECUTING : AgentState.IDLE);
    }

    static Map<String, Object> systemInfo() {
        Runtime runtime = Runtime.getRuntime();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("os", System.getProperty("os.name"));
        info.put("arch", System.getProperty("os.arch"));
        info.put("processors", runtime.availableProcessors());
        info.put("freeMemory", runtime.freeMemory());
        info.put("javaVersion", System.getProperty("java.version"));
        return info;
    }

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
