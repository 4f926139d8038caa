package taskworker.registry;

import java.time.Instant;
import java.util.Map;

/**
 * Producer side of the job store as seen by task handles.
 */
@FunctionalInterface
public interface JobSubmitter {

    /**
     * @return the new job id
     */
    String submit(String taskName, Map<String, Object> payload, Instant scheduledDate);
}
