package taskworker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import taskworker.model.ScheduledJob;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("task") String task,
        @JsonProperty("status") String status,
        @JsonProperty("scheduledDate") Instant scheduledDate,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("result") @JsonRawValue String result,
        @JsonProperty("failMessage") String failMessage,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("claimedAt") Instant claimedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    /** Create response from domain model */
    public static JobResponse from(ScheduledJob job) {
        return new JobResponse(
                job.id(),
                job.taskName(),
                job.status().name(),
                job.scheduledDate(),
                job.payload(),
                job.result(),
                job.failMessage(),
                job.attempts(),
                job.createdAt(),
                job.claimedAt(),
                job.finishedAt());
    }

    /** Compact version for list responses */
    public JobResponse compact() {
        return new JobResponse(
                jobId, task, status, scheduledDate, null, null, failMessage, attempts,
                createdAt, claimedAt, finishedAt);
    }
}
