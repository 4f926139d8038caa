package taskworker.model;

/**
 * Result of pushing back a claimed job.
 */
public enum PushbackResult {
    /** Job moved from RUNNING to FAILED */
    FAILED,

    /** Job was not RUNNING any more - no-op */
    ALREADY_FINISHED,

    /** Job not found */
    NOT_FOUND
}
