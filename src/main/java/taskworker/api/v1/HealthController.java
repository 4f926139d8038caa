package taskworker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskworker.api.Controller;
import taskworker.api.v1.dto.HealthResponse;
import taskworker.config.BackendKind;
import taskworker.model.JobStatus;
import taskworker.repository.JobStore;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final JobStore jobStore;
    private final BackendKind backend;

    public HealthController(JobStore jobStore, BackendKind backend) {
        this.jobStore = jobStore;
        this.backend = backend;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!jobStore.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy(backend.name(), "connection failed");
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        Jsons.toJson(response));
            }

            Map<String, Integer> jobs = new LinkedHashMap<>();
            for (JobStatus status : JobStatus.values()) {
                jobs.put(status.name(), jobStore.countByStatus(status));
            }

            HealthResponse response = HealthResponse.healthy(backend.name(), formatUptime(), VERSION, jobs);
            return ControllerResponse.json(Jsons.toJson(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(backend.name(), e.getMessage());
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        Jsons.toJson(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
