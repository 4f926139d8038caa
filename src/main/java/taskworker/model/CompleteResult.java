package taskworker.model;

/**
 * Result of completing a claimed job.
 */
public enum CompleteResult {
    /** Job moved from RUNNING to COMPLETED */
    COMPLETED,

    /** Job was not RUNNING any more (already completed or pushed back) - no-op */
    ALREADY_FINISHED,

    /** Job not found */
    NOT_FOUND
}
