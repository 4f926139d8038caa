package taskworker.trigger;

/**
 * Zero-argument handler fired by a cron or date trigger.
 */
@FunctionalInterface
public interface ScheduledAction {

    /**
     * @return output to record in the execution audit, may be null
     */
    Object run() throws Exception;
}
