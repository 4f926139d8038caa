package taskworker.scheduler;

import taskworker.repository.JobStore;
import taskworker.trigger.IntervalTrigger;
import taskworker.trigger.TriggerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Puts the dispatcher tick, the stale claim reaper and every cron/date trigger
 * on one scheduling engine.
 */
public class TriggerScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    static final String DISPATCHER_JOB = "dispatcher";
    static final String REAPER_JOB = "stale-claim-reaper";

    private final SchedulingEngine engine;
    private final JobStore jobStore;
    private final ExecutionScope scope;
    private final Clock clock;

    public TriggerScheduler(SchedulingEngine engine, JobStore jobStore, ExecutionScope scope, Clock clock) {
        this.engine = engine;
        this.jobStore = jobStore;
        this.scope = scope;
        this.clock = clock;
    }

    /**
     * Register everything and start the engine.
     *
     * @param dispatcher    polling step run every {@code pollInterval}
     * @param pollInterval  dispatcher period
     * @param reaper        stale claim reaper, or null to disable it
     * @param reaperPeriod  reaper period, ignored when the reaper is null
     * @param registrations cron and date triggers
     */
    public void start(Dispatcher dispatcher, Duration pollInterval,
            StaleClaimReaper reaper, Duration reaperPeriod,
            List<TriggerRegistration> registrations) {

        engine.addJob(DISPATCHER_JOB, new IntervalTrigger(pollInterval), dispatcher);

        if (reaper != null) {
            engine.addJob(REAPER_JOB, new IntervalTrigger(reaperPeriod), reaper);
        }

        for (TriggerRegistration registration : registrations) {
            String id = registration.kind().name().toLowerCase(Locale.ROOT) + ":" + registration.name();
            engine.addJob(id, registration.trigger(), new AuditedExecution(registration, jobStore, scope, clock));
        }

        engine.start();
        log.info("Trigger scheduler started: poll every {}, {} cron/date trigger(s)",
                pollInterval, registrations.size());
    }

    public void shutdown() {
        engine.shutdown();
    }

    public void awaitTermination() throws InterruptedException {
        engine.awaitTermination();
    }

    public boolean isRunning() {
        return engine.isRunning();
    }

    @Override
    public void close() {
        shutdown();
    }
}
