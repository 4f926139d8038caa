package taskworker.exception;

public class UnknownTaskException extends TaskWorkerException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("Task " + taskName + " is not registered");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
