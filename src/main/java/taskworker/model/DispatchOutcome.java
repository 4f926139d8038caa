package taskworker.model;

/**
 * What a single dispatch tick did.
 */
public enum DispatchOutcome {
    /** No due job */
    IDLE,
    /** A job ran and its result was stored */
    COMPLETED,
    /** A job ran and was pushed back */
    FAILED,
    /** A claimed job was not due yet and went back to PENDING */
    RELEASED,
    /** The store could not be reached; tick skipped */
    STORAGE_UNAVAILABLE
}
