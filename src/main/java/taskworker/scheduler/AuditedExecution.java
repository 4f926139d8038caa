package taskworker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import taskworker.model.ExecutionRecord;
import taskworker.repository.JobStore;
import taskworker.trigger.TriggerRegistration;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs a cron or date action and appends one execution record per fire,
 * whether the action succeeded or not.
 */
public class AuditedExecution implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AuditedExecution.class);

    private final TriggerRegistration registration;
    private final JobStore jobStore;
    private final ExecutionScope scope;
    private final Clock clock;

    public AuditedExecution(TriggerRegistration registration, JobStore jobStore, ExecutionScope scope, Clock clock) {
        this.registration = registration;
        this.jobStore = jobStore;
        this.scope = scope;
        this.clock = clock;
    }

    @Override
    public void run() {
        Instant startedAt = clock.instant();
        Object output = null;
        String failMessage = null;
        VirtualMachineError fatal = null;

        try {
            output = scope.call(() -> registration.action().run());
        } catch (Throwable e) {
            fatal = e instanceof VirtualMachineError ? (VirtualMachineError) e : null;
            failMessage = Failures.describe(e);
            log.warn("{} {} failed: {}", registration.kind(), registration.name(), failMessage);
            log.debug("{} failure", registration.name(), e);
        }

        Instant finishedAt = clock.instant();

        String outputJson = null;
        if (failMessage == null) {
            try {
                outputJson = Jsons.toJsonOrNull(output);
            } catch (JsonProcessingException e) {
                failMessage = "Output is not serializable: " + e.getOriginalMessage();
            }
        }

        ExecutionRecord record = new ExecutionRecord(
                UUID.randomUUID().toString(),
                registration.name(),
                registration.kind(),
                startedAt,
                finishedAt,
                outputJson,
                failMessage);

        try {
            jobStore.saveExecution(record);
        } catch (RuntimeException e) {
            log.error("Failed to save execution record for {} started at {}", registration.name(), startedAt, e);
        }

        if (fatal != null) {
            throw fatal;
        }
        log.debug("{} {} ran in {}", registration.kind(), registration.name(), record.duration());
    }
}
