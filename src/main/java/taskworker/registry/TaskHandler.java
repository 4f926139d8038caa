package taskworker.registry;

import java.util.Map;

/**
 * A registered unit of work. Receives the job payload as keyword arguments.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * @param payload keyword arguments, already checked against the task signature
     * @return result to store on the job, may be null
     */
    Object execute(Map<String, Object> payload) throws Exception;
}
