package taskworker.exception;

/**
 * Base type for every failure the worker reports.
 */
public class TaskWorkerException extends RuntimeException {

    public TaskWorkerException(String message) {
        super(message);
    }

    public TaskWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
