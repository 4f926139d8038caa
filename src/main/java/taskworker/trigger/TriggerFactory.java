package taskworker.trigger;

import java.time.ZoneId;

/**
 * Builds a trigger once the worker's default timezone is known.
 * {@link CronSchedule#toTrigger} and {@link DateSchedule#toTrigger} fit.
 */
@FunctionalInterface
public interface TriggerFactory {

    Trigger create(ZoneId defaultZone);
}
