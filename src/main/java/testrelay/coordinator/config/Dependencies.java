package testrelay.coordinator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.internal.v1.AgentController;
import testrelay.coordinator.api.internal.v1.AgentSettingsController;
import testrelay.coordinator.api.internal.v1.JobQueueController;
import testrelay.coordinator.api.v1.HealthController;
import testrelay.coordinator.api.v1.JobController;
import testrelay.coordinator.api.v1.SettingsController;
import testrelay.coordinator.api.v1.TriggerController;
import testrelay.coordinator.api.v1.WorkerController;
import testrelay.coordinator.dispatch.DispatchLock;
import testrelay.coordinator.dispatch.Dispatcher;
import testrelay.coordinator.repository.ActivityLogRepository;
import testrelay.coordinator.repository.DispatchStore;
import testrelay.coordinator.repository.JobRepository;
import testrelay.coordinator.repository.SettingsRepository;
import testrelay.coordinator.repository.TestCatalog;
import testrelay.coordinator.repository.TriggerExecutionRepository;
import testrelay.coordinator.repository.TriggerRepository;
import testrelay.coordinator.repository.WorkerRepository;
import testrelay.coordinator.scheduler.Scheduler;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.ActivityService;
import testrelay.coordinator.service.JobService;
import testrelay.coordinator.service.RetentionCleaner;
import testrelay.coordinator.service.SettingsService;
import testrelay.coordinator.service.TriggerService;
import testrelay.coordinator.service.WorkerService;
import testrelay.coordinator.store.Database;
import testrelay.coordinator.store.JdbcActivityLogRepository;
import testrelay.coordinator.store.JdbcDispatchLock;
import testrelay.coordinator.store.JdbcDispatchStore;
import testrelay.coordinator.store.JdbcJobRepository;
import testrelay.coordinator.store.JdbcSettingsRepository;
import testrelay.coordinator.store.JdbcTestCatalog;
import testrelay.coordinator.store.JdbcTriggerExecutionRepository;
import testrelay.coordinator.store.JdbcTriggerRepository;
import testrelay.coordinator.store.JdbcWorkerRepository;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // start background tasks
 * RouterHandler router = deps.routerHandler();
 * // ... serve requests ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Clock clock;
    private final Database database;

    private final TriggerRepository triggerRepository;
    private final TriggerExecutionRepository executionRepository;
    private final JobRepository jobRepository;
    private final WorkerRepository workerRepository;
    private final SettingsRepository settingsRepository;
    private final ActivityLogRepository activityLogRepository;
    private final TestCatalog testCatalog;
    private final DispatchStore dispatchStore;
    private final DispatchLock dispatchLock;

    private final SettingsService settingsService;
    private final ActivityService activityService;
    private final TriggerService triggerService;
    private final JobService jobService;
    private final WorkerService workerService;
    private final RetentionCleaner retentionCleaner;
    private final Dispatcher dispatcher;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.triggerRepository = new JdbcTriggerRepository(database);
        this.executionRepository = new JdbcTriggerExecutionRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.workerRepository = new JdbcWorkerRepository(database);
        this.settingsRepository = new JdbcSettingsRepository(database);
        this.activityLogRepository = new JdbcActivityLogRepository(database);
        this.testCatalog = new JdbcTestCatalog(database);
        this.dispatchStore = new JdbcDispatchStore(database);
        this.dispatchLock = new JdbcDispatchLock(database);

        // Services
        this.settingsService = new SettingsService(settingsRepository);
        this.activityService = new ActivityService(activityLogRepository);
        this.triggerService = new TriggerService(triggerRepository, executionRepository, clock);
        this.jobService = new JobService(jobRepository, workerRepository, activityService);
        this.workerService = new WorkerService(workerRepository, jobRepository, activityService, config, clock);
        this.retentionCleaner = new RetentionCleaner(jobRepository, executionRepository, activityLogRepository,
                settingsService, clock);
        this.dispatcher = new Dispatcher(triggerRepository, executionRepository, testCatalog, dispatchStore,
                settingsService, dispatchLock, clock, config.defaultMaxRetries());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with a fixed clock, for tests.
     */
    public static Dependencies create(CoordinatorConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TriggerRepository triggerRepository() {
        return triggerRepository;
    }

    public TriggerExecutionRepository executionRepository() {
        return executionRepository;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public TestCatalog testCatalog() {
        return testCatalog;
    }

    public SettingsService settingsService() {
        return settingsService;
    }

    public ActivityService activityService() {
        return activityService;
    }

    public TriggerService triggerService() {
        return triggerService;
    }

    public JobService jobService() {
        return jobService;
    }

    public WorkerService workerService() {
        return workerService;
    }

    public RetentionCleaner retentionCleaner() {
        return retentionCleaner;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    // Public API
                    .registerController(new HealthController(database, jobService, workerService))
                    .registerController(new TriggerController(triggerService, dispatcher))
                    .registerController(new JobController(jobService, config.defaultMaxRetries()))
                    .registerController(new WorkerController(workerService))
                    .registerController(new SettingsController(settingsService))
                    // Internal API
                    .registerController(new AgentController(workerService))
                    .registerController(new JobQueueController(jobService))
                    .registerController(new AgentSettingsController(settingsService));
            log.info("RouterHandler created with {} controllers", 8);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(dispatcher, workerService, retentionCleaner, config);
        }
        return scheduler;
    }

    /**
     * Start the background scheduler for dispatch, worker reaping and retention.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background scheduler.
     */
    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
