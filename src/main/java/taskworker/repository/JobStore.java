package taskworker.repository;

import taskworker.model.CompleteResult;
import taskworker.model.ExecutionRecord;
import taskworker.model.JobStatus;
import taskworker.model.PushbackResult;
import taskworker.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of scheduled jobs and cron/date execution records.
 * One implementation per relational backend.
 *
 * <p>Connectivity failures surface as
 * {@link taskworker.exception.StorageUnavailableException} from every method.
 */
public interface JobStore {

    /**
     * Create the tables and indexes when absent. Safe to call repeatedly.
     */
    void createTables();

    // ---------- producer side ----------

    /**
     * Enqueue a deferred invocation.
     *
     * @param taskName      registered task name
     * @param payload       keyword arguments for the handler
     * @param scheduledDate earliest eligible execution time
     * @return the new job id
     */
    String apply(String taskName, Map<String, Object> payload, Instant scheduledDate);

    // ---------- consumer side ----------

    /**
     * Atomically claim the earliest due PENDING job, moving it to RUNNING.
     * Ties on scheduled date are broken by enqueue order.
     * Two concurrent callers never receive the same job.
     *
     * @param now the instant that decides what is due
     * @return the claimed job, or empty when nothing is due
     */
    Optional<ScheduledJob> claimNext(Instant now);

    /**
     * Mark a claimed job COMPLETED and store its result.
     * Only RUNNING jobs transition; a second call is a no-op.
     *
     * @param job        the claimed job
     * @param resultJson serialized handler result, may be null
     */
    CompleteResult complete(ScheduledJob job, String resultJson);

    /**
     * Mark a claimed job FAILED with a message. The row is kept and is not
     * claimable again until {@link #resubmit} is called.
     */
    PushbackResult pushback(ScheduledJob job, String failMessage);

    /**
     * Return a claimed job to PENDING without recording an outcome.
     *
     * @return true if the job was RUNNING and is PENDING again
     */
    boolean release(ScheduledJob job);

    // ---------- host recovery ----------

    /**
     * Make a FAILED job claimable again at the given date.
     *
     * @return true if the job was FAILED and is PENDING again
     */
    boolean resubmit(String jobId, Instant scheduledDate);

    /**
     * Fail RUNNING jobs claimed before the cutoff. Used to clear claims left
     * behind by a crashed dispatcher without running them twice.
     *
     * @return number of jobs failed
     */
    int failStaleClaims(Instant claimedBefore);

    // ---------- queries ----------

    Optional<ScheduledJob> findById(String jobId);

    List<ScheduledJob> findByStatus(JobStatus status, int limit);

    int countByStatus(JobStatus status);

    /**
     * Most recently touched jobs first.
     */
    List<ScheduledJob> findRecent(int limit);

    // ---------- execution audit ----------

    /**
     * Append one cron/date execution record.
     */
    void saveExecution(ExecutionRecord record);

    /**
     * Execution records for a task, newest first. A null task name returns
     * records for all tasks.
     */
    List<ExecutionRecord> findExecutions(String taskName, int limit);

    int countExecutions(String taskName);

    boolean isHealthy();
}
