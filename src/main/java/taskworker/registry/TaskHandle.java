package taskworker.registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Returned by task registration; schedules deferred runs of that task.
 * The payload is checked against the task signature before it is stored.
 */
public final class TaskHandle {

    private final RegisteredTask task;
    private final JobSubmitter submitter;
    private final Clock clock;

    public TaskHandle(RegisteredTask task, JobSubmitter submitter, Clock clock) {
        this.task = task;
        this.submitter = submitter;
        this.clock = clock;
    }

    public String name() {
        return task.name();
    }

    /** Run as soon as a dispatcher tick picks it up */
    public String apply(Map<String, Object> payload) {
        return apply(payload, clock.instant());
    }

    /** Run at or after the given date */
    public String apply(Map<String, Object> payload, Instant scheduledDate) {
        task.signature().validate(task.name(), payload);
        return submitter.submit(task.name(), payload, scheduledDate);
    }

    public String applyAfter(Map<String, Object> payload, Duration delay) {
        return apply(payload, clock.instant().plus(delay));
    }

    @Override
    public String toString() {
        return "TaskHandle{" + task.name() + task.signature() + "}";
    }
}
