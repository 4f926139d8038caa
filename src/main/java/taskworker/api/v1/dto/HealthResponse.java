package taskworker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("backend") String backend,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("jobs") Map<String, Integer> jobs) {

    public static HealthResponse healthy(String backend, String uptime, String version, Map<String, Integer> jobs) {
        return new HealthResponse("healthy", "ok", backend, uptime, version, jobs);
    }

    public static HealthResponse unhealthy(String backend, String database) {
        return new HealthResponse("unhealthy", database, backend, null, null, null);
    }
}
