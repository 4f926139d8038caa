package taskworker.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Append-only audit entry for one cron or date firing.
 *
 * @param id          record identifier
 * @param taskName    name the trigger was registered under
 * @param triggerKind CRON or DATE
 * @param startedAt   when the handler was entered
 * @param finishedAt  when the handler returned or raised
 * @param output      JSON of the handler return value, null on failure or void
 * @param failMessage stringified error, null on success
 */
public record ExecutionRecord(
        String id,
        String taskName,
        TriggerKind triggerKind,
        Instant startedAt,
        Instant finishedAt,
        String output,
        String failMessage) {

    public ExecutionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(taskName, "taskName is required");
        Objects.requireNonNull(triggerKind, "triggerKind is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        Objects.requireNonNull(finishedAt, "finishedAt is required");
    }

    public boolean succeeded() {
        return failMessage == null;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
