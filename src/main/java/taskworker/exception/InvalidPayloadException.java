package taskworker.exception;

/**
 * Payload keys do not fit the handler signature, or the payload cannot be
 * serialized.
 */
public class InvalidPayloadException extends TaskWorkerException {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
