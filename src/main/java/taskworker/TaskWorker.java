package taskworker;

import taskworker.api.v1.ExecutionController;
import taskworker.api.v1.HealthController;
import taskworker.api.v1.JobController;
import taskworker.api.v1.TaskController;
import taskworker.config.WorkerConfig;
import taskworker.registry.RegisteredTask;
import taskworker.registry.TaskHandle;
import taskworker.registry.TaskHandler;
import taskworker.registry.TaskRegistry;
import taskworker.registry.TaskSignature;
import taskworker.repository.JobStore;
import taskworker.scheduler.Dispatcher;
import taskworker.scheduler.ExecutionScope;
import taskworker.scheduler.ExecutorSchedulingEngine;
import taskworker.scheduler.SchedulingEngine;
import taskworker.scheduler.StaleClaimReaper;
import taskworker.scheduler.TriggerScheduler;
import taskworker.server.AdminServer;
import taskworker.server.RouterHandler;
import taskworker.store.Database;
import taskworker.store.JobStores;
import taskworker.trigger.CronSchedule;
import taskworker.trigger.DateSchedule;
import taskworker.trigger.ScheduledAction;
import taskworker.trigger.TriggerRegistration;
import taskworker.trigger.TriggerTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point for host applications.
 *
 * <pre>
 * TaskWorker worker = new TaskWorker();
 * worker.init(appConfig);
 * TaskHandle sendEmail = worker.defineTask("mail.send", TaskSignature.of("to", "subject"), p -> ...);
 * worker.defineCronTask("reports.nightly", CronSchedule.create().hour("3"), () -> ...);
 * worker.start();
 * sendEmail.apply(Map.of("to", "a@x.com", "subject", "hi"));
 * // ...
 * worker.shutdown();
 * </pre>
 */
public final class TaskWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final Clock clock;
    private final ExecutionScope scope;
    private final TaskRegistry registry = new TaskRegistry();
    private final TriggerTable triggers = new TriggerTable();

    private SchedulingEngine engine;
    private WorkerConfig config;
    private Database database;
    private JobStore jobStore;
    private Dispatcher dispatcher;
    private TriggerScheduler triggerScheduler;
    private AdminServer adminServer;

    private volatile boolean started = false;

    public TaskWorker() {
        this(Clock.systemUTC(), ExecutionScope.direct(), null);
    }

    /**
     * @param clock  time source for due dates and audit timestamps
     * @param scope  context every handler runs inside
     * @param engine scheduling engine, or null for the default single-thread engine
     */
    public TaskWorker(Clock clock, ExecutionScope scope, SchedulingEngine engine) {
        this.clock = clock;
        this.scope = scope;
        this.engine = engine;
    }

    /**
     * Initialize from the host application config.
     *
     * @throws taskworker.exception.MissingDatabaseUriException if no database uri is configured
     */
    public void init(Map<String, String> appConfig) {
        init(WorkerConfig.fromProperties(appConfig));
    }

    /**
     * Open the pool and select the job store for the configured backend.
     * Tables are created by {@link #start()}.
     *
     * @throws taskworker.exception.MissingDatabaseUriException if no database uri is configured
     */
    public synchronized void init(WorkerConfig config) {
        if (this.config != null) {
            throw new IllegalStateException("TaskWorker already initialized");
        }

        // fail before anything is opened
        config.requireDatabaseUrl();

        log.info("Initializing task worker with config: {}", config);
        this.database = new Database(config);
        this.jobStore = JobStores.create(database, clock);
        this.config = config;
    }

    // ---------- registration ----------

    /**
     * Register a task that accepts any payload.
     */
    public TaskHandle defineTask(String name, TaskHandler handler) {
        return defineTask(name, TaskSignature.any(), handler);
    }

    /**
     * Register a deferred task.
     *
     * @return handle for scheduling runs of the task
     * @throws taskworker.exception.DuplicateTaskException if the name is taken
     */
    public TaskHandle defineTask(String name, TaskSignature signature, TaskHandler handler) {
        RegisteredTask task = registry.register(name, signature, handler);
        return new TaskHandle(task, this::submit, clock);
    }

    /**
     * Register a recurring calendar trigger.
     *
     * @return the action, unchanged
     * @throws taskworker.exception.InvalidTriggerException if the schedule is invalid
     */
    public ScheduledAction defineCronTask(String name, CronSchedule schedule, ScheduledAction action) {
        triggers.add(name, schedule::toTrigger, action);
        return action;
    }

    /**
     * Register a one-shot trigger.
     *
     * @return the action, unchanged
     */
    public ScheduledAction defineDateTask(String name, DateSchedule schedule, ScheduledAction action) {
        triggers.add(name, schedule::toTrigger, action);
        return action;
    }

    // ---------- lifecycle ----------

    /**
     * Create tables, freeze registrations, start the scheduler and, when a
     * port is configured, the admin API. Returns immediately.
     */
    public synchronized void start() {
        requireInitialized();
        if (started) {
            log.warn("TaskWorker already started");
            return;
        }

        jobStore.createTables();

        registry.freeze();
        List<TriggerRegistration> registrations = triggers.freeze(config.timezone());

        dispatcher = new Dispatcher(jobStore, registry, scope, clock, config.drainMode());
        StaleClaimReaper reaper = config.hasStaleClaimReaper()
                ? new StaleClaimReaper(jobStore, config.staleClaimThreshold(), clock)
                : null;

        if (engine == null) {
            engine = new ExecutorSchedulingEngine(clock);
        }
        triggerScheduler = new TriggerScheduler(engine, jobStore, scope, clock);
        triggerScheduler.start(dispatcher, config.pollInterval(),
                reaper, config.staleClaimCheckInterval(), registrations);

        if (config.hasAdminServer()) {
            adminServer = new AdminServer(config.adminHost(), config.adminPort(), routerHandler());
            adminServer.start();
        }

        started = true;
        log.info("TaskWorker started: {} task(s), {} trigger(s), drain mode {}",
                registry.names().size(), registrations.size(), config.drainMode() ? "on" : "off");
    }

    /**
     * Start and block the calling thread until {@link #shutdown()} is called
     * from another thread or the thread is interrupted.
     */
    public void startBlocking() {
        start();
        try {
            triggerScheduler.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down");
            shutdown();
        }
    }

    public synchronized void shutdown() {
        log.info("Shutting down task worker...");

        if (adminServer != null) {
            try {
                adminServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping admin API: {}", e.getMessage());
            }
        }

        if (triggerScheduler != null) {
            try {
                triggerScheduler.shutdown();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        started = false;
        log.info("Task worker stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------- producer side ----------

    /**
     * Enqueue a run of a registered task by name.
     *
     * @throws taskworker.exception.UnknownTaskException   if no task has this name
     * @throws taskworker.exception.InvalidPayloadException if the payload does not fit
     */
    public String apply(String taskName, Map<String, Object> payload, Instant scheduledDate) {
        return new TaskHandle(registry.resolve(taskName), this::submit, clock).apply(payload, scheduledDate);
    }

    private String submit(String taskName, Map<String, Object> payload, Instant scheduledDate) {
        requireInitialized();
        return jobStore.apply(taskName, payload, scheduledDate);
    }

    private RouterHandler routerHandler() {
        return new RouterHandler(config)
                .registerController(new HealthController(jobStore, database.backend()))
                .registerController(new JobController(jobStore, clock))
                .registerController(new TaskController(registry, this::submit, clock))
                .registerController(new ExecutionController(jobStore));
    }

    private void requireInitialized() {
        if (jobStore == null) {
            throw new IllegalStateException("TaskWorker not initialized, call init() first");
        }
    }

    // Getters
    public WorkerConfig config() {
        return config;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public TaskRegistry registry() {
        return registry;
    }

    /** Null until started */
    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /** Null unless the admin API is running */
    public AdminServer adminServer() {
        return adminServer;
    }

    public boolean isStarted() {
        return started;
    }
}
