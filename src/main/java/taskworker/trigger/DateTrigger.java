package taskworker.trigger;

import taskworker.model.TriggerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires exactly once. No run date means fire at start. A run date already
 * past by more than {@link #MISFIRE_GRACE} is skipped, so restarting the
 * host does not run it again.
 */
public final class DateTrigger implements Trigger {

    private static final Logger log = LoggerFactory.getLogger(DateTrigger.class);

    static final Duration MISFIRE_GRACE = Duration.ofSeconds(1);

    private final Instant runDate;

    public DateTrigger(Instant runDate) {
        this.runDate = runDate;
    }

    public Instant runDate() {
        return runDate;
    }

    @Override
    public TriggerKind kind() {
        return TriggerKind.DATE;
    }

    @Override
    public Optional<Instant> firstFireTime(Instant now) {
        if (runDate == null) {
            return Optional.of(now);
        }
        if (runDate.isBefore(now.minus(MISFIRE_GRACE))) {
            log.warn("Run date {} was missed by {}, not firing", runDate, Duration.between(runDate, now));
            return Optional.empty();
        }
        return Optional.of(runDate.isBefore(now) ? now : runDate);
    }

    @Override
    public Optional<Instant> nextFireTime(Instant previous) {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "date[" + (runDate != null ? runDate : "now") + "]";
    }
}
