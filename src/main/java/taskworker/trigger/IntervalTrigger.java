package taskworker.trigger;

import taskworker.model.TriggerKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires every {@code period}, first one period after start.
 */
public final class IntervalTrigger implements Trigger {

    private final Duration period;

    public IntervalTrigger(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + period);
        }
        this.period = period;
    }

    public Duration period() {
        return period;
    }

    @Override
    public TriggerKind kind() {
        return TriggerKind.INTERVAL;
    }

    @Override
    public Optional<Instant> firstFireTime(Instant now) {
        return Optional.of(now.plus(period));
    }

    @Override
    public Optional<Instant> nextFireTime(Instant previous) {
        return Optional.of(previous.plus(period));
    }

    @Override
    public String toString() {
        return "interval[" + period + "]";
    }
}
