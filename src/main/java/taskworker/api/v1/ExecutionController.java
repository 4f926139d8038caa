package taskworker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskworker.api.Controller;
import taskworker.api.v1.dto.ExecutionResponse;
import taskworker.exception.StorageUnavailableException;
import taskworker.repository.JobStore;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Cron/date execution audit.
 * GET /api/v1/executions?task=name&limit=50
 */
public class ExecutionController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final JobStore jobStore;

    public ExecutionController(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/executions".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            int limit = Controller.limitParam(req, DEFAULT_LIMIT, MAX_LIMIT);
            String task = Controller.queryParam(req, "task");
            if (task != null && task.isBlank()) {
                task = null;
            }

            List<ExecutionResponse> items = jobStore.findExecutions(task, limit).stream()
                    .map(ExecutionResponse::from)
                    .toList();

            Map<String, Object> response = Map.of(
                    "count", items.size(),
                    "total", jobStore.countExecutions(task),
                    "executions", items);

            return ControllerResponse.json(Jsons.toJson(response));

        } catch (StorageUnavailableException e) {
            log.warn("Job store unavailable: {}", e.getMessage());
            return ControllerResponse.unavailable("job store unavailable");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Execution controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
