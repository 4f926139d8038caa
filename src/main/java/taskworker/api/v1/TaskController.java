package taskworker.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskworker.api.Controller;
import taskworker.api.v1.dto.ApplyTaskResponse;
import taskworker.exception.InvalidPayloadException;
import taskworker.exception.StorageUnavailableException;
import taskworker.exception.UnknownTaskException;
import taskworker.registry.JobSubmitter;
import taskworker.registry.RegisteredTask;
import taskworker.registry.TaskHandle;
import taskworker.registry.TaskRegistry;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for registered tasks.
 *
 * GET /api/v1/tasks - List task names and signatures
 * POST /api/v1/tasks/{name}/apply?at=...|delay=seconds - Enqueue a deferred run; body is the payload object
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_APPLY_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/apply$");

    private final TaskRegistry registry;
    private final JobSubmitter submitter;
    private final Clock clock;

    public TaskController(TaskRegistry registry, JobSubmitter submitter, Clock clock) {
        this.registry = registry;
        this.submitter = submitter;
        this.clock = clock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASK_APPLY_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.GET) && TASKS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher applyMatcher = TASK_APPLY_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && applyMatcher.matches()) {
                return handleApply(req, QueryStringDecoder.decodeComponent(applyMatcher.group(1)));
            }
            return handleList();

        } catch (UnknownTaskException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (InvalidPayloadException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (StorageUnavailableException e) {
            log.warn("Job store unavailable: {}", e.getMessage());
            return ControllerResponse.unavailable("job store unavailable");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList() throws Exception {
        List<Map<String, Object>> tasks = new ArrayList<>();
        for (String name : registry.names()) {
            RegisteredTask task = registry.resolve(name);
            tasks.add(Map.of(
                    "name", name,
                    "required", task.signature().required(),
                    "optional", task.signature().optional()));
        }
        return ControllerResponse.json(Jsons.toJson(Map.of("tasks", tasks)));
    }

    /**
     * POST /api/v1/tasks/{name}/apply
     */
    private ControllerResponse handleApply(FullHttpRequest req, String taskName) throws Exception {
        RegisteredTask task = registry.resolve(taskName);

        String body = req.content().toString(StandardCharsets.UTF_8);
        Map<String, Object> payload;
        try {
            payload = Jsons.toMap(body);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload must be a JSON object: " + e.getOriginalMessage());
        }

        Instant scheduledDate = scheduledDate(req);
        String jobId = new TaskHandle(task, submitter, clock).apply(payload, scheduledDate);

        log.info("Job {} enqueued for {} via admin API", jobId, taskName);
        ApplyTaskResponse response = new ApplyTaskResponse(true, jobId, taskName, scheduledDate);
        return ControllerResponse.json(HttpResponseStatus.CREATED, Jsons.toJson(response));
    }

    private Instant scheduledDate(FullHttpRequest req) {
        Instant at = JobController.parseInstant(Controller.queryParam(req, "at"));
        if (at != null) {
            return at;
        }
        String delay = Controller.queryParam(req, "delay");
        if (delay != null && !delay.isBlank()) {
            try {
                return clock.instant().plus(Duration.ofSeconds(Long.parseLong(delay.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("delay must be a number of seconds: " + delay);
            }
        }
        return clock.instant();
    }
}
