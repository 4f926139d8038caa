package taskworker.exception;

/**
 * The job store backend could not be reached. Transient: the dispatcher skips
 * the tick instead of failing.
 */
public class StorageUnavailableException extends TaskWorkerException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
