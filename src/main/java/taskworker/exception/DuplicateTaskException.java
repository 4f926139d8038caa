package taskworker.exception;

public class DuplicateTaskException extends TaskWorkerException {
    public DuplicateTaskException(String taskName) {
        super("Task " + taskName + " is already registered");
    }
}
