package taskworker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * POST /api/v1/tasks/{name}/apply
 */
public record ApplyTaskResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("task") String task,
        @JsonProperty("scheduledDate") Instant scheduledDate) {
}
