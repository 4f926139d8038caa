package taskworker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import taskworker.model.ExecutionRecord;

import java.time.Instant;

/**
 * One cron/date execution record.
 * GET /api/v1/executions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("task") String task,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("output") @JsonRawValue String output,
        @JsonProperty("failMessage") String failMessage) {

    public static ExecutionResponse from(ExecutionRecord record) {
        return new ExecutionResponse(
                record.id(),
                record.taskName(),
                record.triggerKind().name(),
                record.startedAt(),
                record.finishedAt(),
                record.duration().toMillis(),
                record.output(),
                record.failMessage());
    }
}
