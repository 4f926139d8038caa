package taskworker.trigger;

import taskworker.model.TriggerKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes when a scheduled action fires.
 * An empty result means the trigger will not fire again.
 */
public interface Trigger {

    TriggerKind kind();

    /**
     * First fire time strictly after the scheduler start.
     */
    Optional<Instant> firstFireTime(Instant now);

    /**
     * Fire time following {@code previous}.
     */
    Optional<Instant> nextFireTime(Instant previous);

    /**
     * Upper bound of the random delay added to each fire. Zero for none.
     */
    default Duration jitter() {
        return Duration.ZERO;
    }
}
