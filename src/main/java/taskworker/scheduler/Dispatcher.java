package taskworker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import taskworker.exception.StorageUnavailableException;
import taskworker.model.CompleteResult;
import taskworker.model.DispatchOutcome;
import taskworker.model.ScheduledJob;
import taskworker.registry.TaskRegistry;
import taskworker.repository.JobStore;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Polling step for deferred jobs: claim one due job, run it, record the outcome.
 *
 * Each tick runs at most one job unless drain mode is on, in which case the
 * tick keeps claiming until nothing is due.
 */
public class Dispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobStore jobStore;
    private final TaskRegistry registry;
    private final ExecutionScope scope;
    private final Clock clock;
    private final boolean drainMode;

    public Dispatcher(JobStore jobStore, TaskRegistry registry, ExecutionScope scope, Clock clock,
            boolean drainMode) {
        this.jobStore = jobStore;
        this.registry = registry;
        this.scope = scope;
        this.clock = clock;
        this.drainMode = drainMode;
    }

    @Override
    public void run() {
        if (drainMode) {
            drain();
        } else {
            pollOnce();
        }
    }

    /**
     * Run due jobs until none is left or the store stops answering.
     *
     * @return number of jobs that ran
     */
    public int drain() {
        int ran = 0;
        while (true) {
            DispatchOutcome outcome = pollOnce();
            if (outcome != DispatchOutcome.COMPLETED && outcome != DispatchOutcome.FAILED) {
                break;
            }
            ran++;
        }
        if (ran > 0) {
            log.info("Drained {} job(s)", ran);
        }
        return ran;
    }

    /**
     * Claim and run at most one due job.
     */
    public DispatchOutcome pollOnce() {
        Optional<ScheduledJob> claimed;
        try {
            claimed = jobStore.claimNext(clock.instant());
        } catch (StorageUnavailableException e) {
            log.warn("Job store unavailable, skipping tick: {}", e.getMessage());
            return DispatchOutcome.STORAGE_UNAVAILABLE;
        }

        if (claimed.isEmpty()) {
            log.debug("No due jobs");
            return DispatchOutcome.IDLE;
        }

        ScheduledJob job = claimed.get();
        try {
            return execute(job);
        } catch (StorageUnavailableException e) {
            log.warn("Job store unavailable while finishing job {}, it stays RUNNING: {}", job.id(), e.getMessage());
            return DispatchOutcome.STORAGE_UNAVAILABLE;
        }
    }

    private DispatchOutcome execute(ScheduledJob job) {
        // clock may have moved back since the claim
        if (!job.isDue(clock.instant())) {
            jobStore.release(job);
            log.warn("Job {} claimed before its scheduled date {}, released", job.id(), job.scheduledDate());
            return DispatchOutcome.RELEASED;
        }

        Object result;
        try {
            result = scope.call(() -> registry.invoke(job.taskName(), job.payload()));
        } catch (Throwable e) {
            DispatchOutcome outcome = pushback(job, Failures.describe(e), e);
            Failures.rethrowIfFatal(e);
            return outcome;
        }

        String resultJson;
        try {
            resultJson = Jsons.toJsonOrNull(result);
        } catch (JsonProcessingException e) {
            return pushback(job, "Result is not serializable: " + e.getOriginalMessage(), e);
        }

        CompleteResult completed = jobStore.complete(job, resultJson);
        if (completed != CompleteResult.COMPLETED) {
            log.warn("Job {} could not be completed: {}", job.id(), completed);
            return DispatchOutcome.FAILED;
        }

        log.info("Job {} ({}) completed", job.id(), job.taskName());
        return DispatchOutcome.COMPLETED;
    }

    private DispatchOutcome pushback(ScheduledJob job, String failMessage, Throwable cause) {
        jobStore.pushback(job, failMessage);
        log.warn("Job {} ({}) failed: {}", job.id(), job.taskName(), failMessage);
        log.debug("Job {} failure", job.id(), cause);
        return DispatchOutcome.FAILED;
    }
}
