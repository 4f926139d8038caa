package taskworker.trigger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Parameters of a one-shot date trigger.
 * A local run date is read in the schedule's timezone, or the worker's
 * default timezone when none is set.
 */
public final class DateSchedule {

    private Instant runInstant;
    private LocalDateTime runLocal;
    private ZoneId timezone;

    private DateSchedule() {
    }

    /** Fire once, as soon as the scheduler starts */
    public static DateSchedule now() {
        return new DateSchedule();
    }

    public static DateSchedule at(Instant runDate) {
        DateSchedule s = new DateSchedule();
        s.runInstant = runDate;
        return s;
    }

    public static DateSchedule at(LocalDateTime runDate) {
        DateSchedule s = new DateSchedule();
        s.runLocal = runDate;
        return s;
    }

    public DateSchedule timezone(ZoneId timezone) {
        this.timezone = timezone;
        return this;
    }

    public DateTrigger toTrigger(ZoneId defaultZone) {
        if (runInstant != null) {
            return new DateTrigger(runInstant);
        }
        if (runLocal != null) {
            ZoneId zone = timezone != null ? timezone : defaultZone;
            return new DateTrigger(runLocal.atZone(zone).toInstant());
        }
        return new DateTrigger(null);
    }
}
