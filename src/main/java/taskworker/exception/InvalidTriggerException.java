package taskworker.exception;

/**
 * A cron or date trigger was rejected at registration time.
 */
public class InvalidTriggerException extends TaskWorkerException {

    public InvalidTriggerException(String message) {
        super(message);
    }

    public InvalidTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
