package taskworker.model;

/**
 * Shapes of trigger the scheduler can fire.
 */
public enum TriggerKind {
    INTERVAL,
    CRON,
    DATE
}
