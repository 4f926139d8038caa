package taskworker.scheduler;

import java.util.concurrent.Callable;

/**
 * Host-provided context every handler runs inside, for example a
 * transaction or a request-like scope.
 */
@FunctionalInterface
public interface ExecutionScope {

    Object call(Callable<Object> body) throws Exception;

    /** Runs the body directly */
    static ExecutionScope direct() {
        return Callable::call;
    }
}
