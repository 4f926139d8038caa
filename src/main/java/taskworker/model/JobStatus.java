package taskworker.model;

/**
 * Scheduled job lifecycle status.
 */
public enum JobStatus {
    /** Enqueued, claimable once its scheduled date is reached */
    PENDING,
    /** Claimed by a dispatcher, handler in flight */
    RUNNING,
    /** Handler returned, result stored */
    COMPLETED,
    /** Handler raised (pushed back); claimable again only after a manual resubmit */
    FAILED
}
