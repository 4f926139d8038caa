package taskworker.exception;

public class MissingDatabaseUriException extends TaskWorkerException {

    public MissingDatabaseUriException() {
        super("Database uri not defined in application config");
    }

    public MissingDatabaseUriException(String message) {
        super(message);
    }
}
